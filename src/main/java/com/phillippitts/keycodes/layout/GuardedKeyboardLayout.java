package com.phillippitts.keycodes.layout;

import com.phillippitts.keycodes.domain.KeyCode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.AWTError;
import java.util.Optional;

/**
 * Serializes calls to a layout source that may be non-reentrant or thread-restricted,
 * and turns its failures into empty results. Toolkit errors ({@link AWTError},
 * {@link LinkageError}) count as failures too.
 */
public final class GuardedKeyboardLayout implements KeyboardLayout {

    private static final Logger LOG = LogManager.getLogger(GuardedKeyboardLayout.class);

    private final KeyboardLayout delegate;
    private final Object lock = new Object();

    private GuardedKeyboardLayout(KeyboardLayout delegate) {
        this.delegate = delegate;
    }

    /** Wraps the source unless it is already guarded or needs no guard. */
    public static KeyboardLayout wrap(KeyboardLayout delegate) {
        if (delegate == null) {
            return NoKeyboardLayout.INSTANCE;
        }
        if (delegate instanceof GuardedKeyboardLayout || delegate instanceof NoKeyboardLayout) {
            return delegate;
        }
        return new GuardedKeyboardLayout(delegate);
    }

    @Override
    public Optional<String> glyphFor(KeyCode key) {
        synchronized (lock) {
            try {
                Optional<String> glyph = delegate.glyphFor(key);
                return glyph == null ? Optional.empty() : glyph.filter(g -> !g.isEmpty());
            } catch (RuntimeException | AWTError | LinkageError e) {
                LOG.debug("Keyboard layout '{}' failed for {}: {}", delegate, key, e.toString());
                return Optional.empty();
            }
        }
    }

    @Override
    public String toString() {
        return "guarded(" + delegate + ")";
    }
}
