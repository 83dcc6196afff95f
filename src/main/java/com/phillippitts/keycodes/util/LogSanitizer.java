package com.phillippitts.keycodes.util;

/** Utility for privacy-safe logging of untrusted text, such as key names from config or requests. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Truncate and replace control characters with '?', so that text read from a hook or
     * a request cannot forge log lines.
     */
    public static String forLog(String s, int max) {
        String t = truncate(s, max);
        StringBuilder sb = new StringBuilder(t.length());
        for (int i = 0; i < t.length(); i++) {
            char c = t.charAt(i);
            sb.append(Character.isISOControl(c) ? '?' : c);
        }
        return sb.toString();
    }
}
