package com.phillippitts.keycodes.layout;

import com.phillippitts.keycodes.domain.KeyCode;

import java.util.Optional;

/**
 * Reports the glyph a physical key currently produces under the user's keyboard layout.
 *
 * <p>Implementations must signal every failure (unsupported platform, permission denied,
 * no current layout, no mapping for the key) as an empty result, never as an exception.
 * Platform queries may be blocking or bound to a UI thread, so callers must not assume
 * an implementation is safe to call concurrently unless it documents so; wrap such
 * sources in {@link GuardedKeyboardLayout}.
 */
@FunctionalInterface
public interface KeyboardLayout {

    /**
     * @param key a writing system key
     * @return the unshifted glyph the key produces, or empty if unknown
     */
    Optional<String> glyphFor(KeyCode key);
}
