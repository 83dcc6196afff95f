package com.phillippitts.keycodes.layout;

import com.phillippitts.keycodes.domain.KeyCode;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.phillippitts.keycodes.domain.KeyCode.*;

/**
 * Built-in glyph tables for common keyboard layouts, keyed by the input locale that
 * usually selects them. Glyphs are the unshifted characters, as a platform layout query
 * reports them (lowercase letters, dead keys as their spacing character).
 */
public enum StandardLayout {

    US(Locale.US, qwerty().build()),

    GERMAN(Locale.GERMANY, qwerty()
            .put(KEY_Y, "z").put(KEY_Z, "y")
            .put(BACKQUOTE, "^").put(MINUS, "ß").put(EQUAL, "´")
            .put(BRACKET_LEFT, "ü").put(BRACKET_RIGHT, "+").put(BACKSLASH, "#")
            .put(SEMICOLON, "ö").put(QUOTE, "ä").put(SLASH, "-")
            .put(INTL_BACKSLASH, "<")
            .build()),

    FRENCH(Locale.FRANCE, qwerty()
            .put(KEY_Q, "a").put(KEY_A, "q").put(KEY_W, "z").put(KEY_Z, "w")
            .put(SEMICOLON, "m").put(KEY_M, ",").put(COMMA, ";").put(PERIOD, ":").put(SLASH, "!")
            .put(BACKQUOTE, "²").put(DIGIT_1, "&").put(DIGIT_2, "é").put(DIGIT_3, "\"")
            .put(DIGIT_4, "'").put(DIGIT_5, "(").put(DIGIT_6, "-").put(DIGIT_7, "è")
            .put(DIGIT_8, "_").put(DIGIT_9, "ç").put(DIGIT_0, "à").put(MINUS, ")")
            .put(BRACKET_LEFT, "^").put(BRACKET_RIGHT, "$").put(QUOTE, "ù").put(BACKSLASH, "*")
            .put(INTL_BACKSLASH, "<")
            .build());

    private final Locale locale;
    private final FixedKeyboardLayout layout;

    StandardLayout(Locale locale, Map<KeyCode, String> glyphs) {
        this.locale = locale;
        this.layout = new FixedKeyboardLayout(locale.toLanguageTag(), glyphs);
    }

    public Locale locale() {
        return locale;
    }

    public FixedKeyboardLayout layout() {
        return layout;
    }

    /**
     * Picks the table for an input locale: exact language and country first,
     * then the first table with the same language.
     */
    public static Optional<StandardLayout> forLocale(Locale locale) {
        if (locale == null) {
            return Optional.empty();
        }
        Optional<StandardLayout> exact = Arrays.stream(values())
                .filter(l -> l.locale.getLanguage().equals(locale.getLanguage())
                        && l.locale.getCountry().equals(locale.getCountry()))
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return Arrays.stream(values())
                .filter(l -> l.locale.getLanguage().equals(locale.getLanguage()))
                .findFirst();
    }

    private static Glyphs qwerty() {
        Glyphs g = new Glyphs();
        for (char c = 'A'; c <= 'Z'; c++) {
            g.put(KeyCode.valueOf("KEY_" + c), String.valueOf(Character.toLowerCase(c)));
        }
        for (char c = '0'; c <= '9'; c++) {
            g.put(KeyCode.valueOf("DIGIT_" + c), String.valueOf(c));
        }
        return g.put(BACKQUOTE, "`").put(MINUS, "-").put(EQUAL, "=")
                .put(BRACKET_LEFT, "[").put(BRACKET_RIGHT, "]").put(BACKSLASH, "\\")
                .put(SEMICOLON, ";").put(QUOTE, "'").put(COMMA, ",").put(PERIOD, ".")
                .put(SLASH, "/");
    }

    private static final class Glyphs {
        private final Map<KeyCode, String> map = new EnumMap<>(KeyCode.class);

        Glyphs put(KeyCode key, String glyph) {
            map.put(key, glyph);
            return this;
        }

        Map<KeyCode, String> build() {
            return map;
        }
    }
}
