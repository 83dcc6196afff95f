package com.phillippitts.keycodes.config.layout;

/**
 * Where writing system key glyphs come from.
 * <p>
 * Spring Boot relaxed binding maps property values like "input-locale" to INPUT_LOCALE.
 */
public enum LayoutSource {
    /** No layout information; labels equal the US baseline. */
    NONE,
    /** Built-in table chosen from the current AWT input locale. */
    INPUT_LOCALE,
    /** Built-in table chosen by {@code keycodes.layout.locale}. */
    STANDARD
}
