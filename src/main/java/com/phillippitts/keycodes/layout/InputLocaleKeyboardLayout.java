package com.phillippitts.keycodes.layout;

import com.phillippitts.keycodes.domain.KeyCode;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Derives glyphs from the current input locale by picking the matching {@link StandardLayout}.
 * The locale is queried on every call, so switching the input language takes effect immediately.
 */
public final class InputLocaleKeyboardLayout implements KeyboardLayout {

    private final Supplier<Optional<Locale>> localeSource;

    public InputLocaleKeyboardLayout(Supplier<Optional<Locale>> localeSource) {
        if (localeSource == null) {
            throw new IllegalArgumentException("localeSource must not be null");
        }
        this.localeSource = localeSource;
    }

    @Override
    public Optional<String> glyphFor(KeyCode key) {
        return localeSource.get()
                .flatMap(StandardLayout::forLocale)
                .flatMap(layout -> layout.layout().glyphFor(key));
    }

    @Override
    public String toString() {
        return "input-locale";
    }
}
