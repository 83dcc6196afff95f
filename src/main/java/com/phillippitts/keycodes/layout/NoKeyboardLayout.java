package com.phillippitts.keycodes.layout;

import com.phillippitts.keycodes.domain.KeyCode;

import java.util.Optional;

/** Layout source for platforms without a layout query; every label falls back to the baseline. */
public final class NoKeyboardLayout implements KeyboardLayout {

    public static final NoKeyboardLayout INSTANCE = new NoKeyboardLayout();

    private NoKeyboardLayout() {}

    @Override
    public Optional<String> glyphFor(KeyCode key) {
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "none";
    }
}
