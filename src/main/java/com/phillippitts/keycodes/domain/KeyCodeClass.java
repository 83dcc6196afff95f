package com.phillippitts.keycodes.domain;

import java.util.Arrays;
import java.util.List;

/**
 * Categories used to group {@link KeyCode}s, e.g. in a hotkey picker.
 * Every key belongs to exactly one class; see {@link KeyCode#classify()}.
 */
public enum KeyCodeClass {
    /** Printable keys whose glyph depends on the keyboard layout. */
    WRITING_SYSTEM,
    /** Modifiers, space, tab, enter and IME composition keys. */
    FUNCTIONAL,
    CONTROL_PAD,
    ARROW_PAD,
    NUMPAD,
    /** Escape, F1..F24 and the keys next to them. */
    FUNCTION,
    MEDIA,
    LEGACY,
    GAMEPAD,
    /** Vendor or browser specific keys outside the standard sections. */
    NON_STANDARD;

    /** @return the keys of this class in declaration order */
    public List<KeyCode> members() {
        return Arrays.stream(KeyCode.values())
                .filter(k -> k.classify() == this)
                .toList();
    }
}
