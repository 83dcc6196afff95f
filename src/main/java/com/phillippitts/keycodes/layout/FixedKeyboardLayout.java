package com.phillippitts.keycodes.layout;

import com.phillippitts.keycodes.domain.KeyCode;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable table of glyphs per key. Thread-safe.
 * Keys without an entry resolve to empty, or to the fallback layout when one is given.
 */
public final class FixedKeyboardLayout implements KeyboardLayout {

    private final String name;
    private final Map<KeyCode, String> glyphs;
    private final KeyboardLayout fallback;

    public FixedKeyboardLayout(String name, Map<KeyCode, String> glyphs) {
        this(name, glyphs, NoKeyboardLayout.INSTANCE);
    }

    public FixedKeyboardLayout(String name, Map<KeyCode, String> glyphs, KeyboardLayout fallback) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (fallback == null) {
            throw new IllegalArgumentException("fallback must not be null");
        }
        Map<KeyCode, String> copy = new EnumMap<>(KeyCode.class);
        if (glyphs != null) {
            glyphs.forEach((k, g) -> {
                if (g == null || g.isEmpty()) {
                    throw new IllegalArgumentException("Empty glyph for key " + k.code());
                }
                copy.put(k, g);
            });
        }
        this.name = name;
        this.glyphs = Map.copyOf(copy);
        this.fallback = fallback;
    }

    @Override
    public Optional<String> glyphFor(KeyCode key) {
        String glyph = glyphs.get(key);
        return glyph != null ? Optional.of(glyph) : fallback.glyphFor(key);
    }

    /** @return number of keys with an explicit glyph */
    public int size() {
        return glyphs.size();
    }

    @Override
    public String toString() {
        return name + (fallback == NoKeyboardLayout.INSTANCE ? "" : " -> " + fallback);
    }
}
