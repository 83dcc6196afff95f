package com.phillippitts.keycodes.exception;

import com.phillippitts.keycodes.util.LogSanitizer;

/**
 * Thrown when a key name matches neither a canonical key code nor an accepted alias.
 * Callers loading persisted bindings usually ignore or reject the binding; it is never fatal.
 */
public class UnknownKeyCodeException extends KeyCodesException {

    /** Longest part of the rejected text echoed back in messages. */
    private static final int MAX_ECHO_LENGTH = 64;

    private final String keyText;

    public UnknownKeyCodeException(String keyText) {
        super("Unrecognized key code: '" + LogSanitizer.truncate(keyText, MAX_ECHO_LENGTH) + "'");
        this.keyText = keyText;
    }

    /** @return the rejected text, untruncated; may be null */
    public String getKeyText() {
        return keyText;
    }
}
