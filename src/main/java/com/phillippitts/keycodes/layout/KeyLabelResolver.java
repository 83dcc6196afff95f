package com.phillippitts.keycodes.layout;

import com.phillippitts.keycodes.domain.KeyCode;
import com.phillippitts.keycodes.domain.KeyCodeClass;

import java.util.Locale;
import java.util.Optional;

/**
 * Produces the label a user should see for a key under their actual keyboard layout.
 *
 * <p>Only writing system keys consult the layout; every other key is labeled with
 * {@link KeyCode#label()}. A glyph reported by the layout is upper-cased, except for
 * "ß", which has no single-character uppercase form. When the layout reports nothing
 * the baseline label is used. This class never throws and keeps no cache.
 */
public class KeyLabelResolver {

    static final String SHARP_S = "ß";

    private final KeyboardLayout layout;

    public KeyLabelResolver(KeyboardLayout layout) {
        this.layout = GuardedKeyboardLayout.wrap(layout);
    }

    /** Label and whether it came from the layout rather than the baseline table. */
    public record Resolution(KeyCode key, String label, boolean fromLayout) {}

    /** @return the display label for the key, never empty */
    public String resolve(KeyCode key) {
        return resolveDetailed(key).label();
    }

    public Resolution resolveDetailed(KeyCode key) {
        if (key.classify() != KeyCodeClass.WRITING_SYSTEM) {
            return new Resolution(key, key.label(), false);
        }
        Optional<String> glyph = layout.glyphFor(key);
        return glyph.map(g -> new Resolution(key, normalize(g), true))
                .orElseGet(() -> new Resolution(key, key.label(), false));
    }

    static String normalize(String glyph) {
        if (SHARP_S.equals(glyph)) {
            return glyph;
        }
        return glyph.toUpperCase(Locale.ROOT);
    }

    public KeyboardLayout layout() {
        return layout;
    }
}
