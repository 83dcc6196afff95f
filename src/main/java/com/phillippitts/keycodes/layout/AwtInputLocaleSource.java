package com.phillippitts.keycodes.layout;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.GraphicsEnvironment;
import java.awt.im.InputContext;
import java.util.Locale;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Reads the locale of the active input method from AWT.
 *
 * <p>Yields empty in headless environments and whenever the toolkit cannot be loaded
 * (no display, missing native libraries). AWT input contexts are not thread-safe;
 * use this source only behind {@link GuardedKeyboardLayout}.
 */
public final class AwtInputLocaleSource implements Supplier<Optional<Locale>> {

    private static final Logger LOG = LogManager.getLogger(AwtInputLocaleSource.class);

    private final BooleanSupplier headless;
    private final Supplier<Locale> toolkitLocale;

    public AwtInputLocaleSource() {
        this(GraphicsEnvironment::isHeadless, AwtInputLocaleSource::inputContextLocale);
    }

    // Package-private for tests
    AwtInputLocaleSource(BooleanSupplier headless, Supplier<Locale> toolkitLocale) {
        this.headless = headless;
        this.toolkitLocale = toolkitLocale;
    }

    @Override
    public Optional<Locale> get() {
        if (headless.getAsBoolean()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(toolkitLocale.get());
        } catch (Throwable t) {
            LOG.debug("AWT input locale unavailable: {}", t.toString());
            return Optional.empty();
        }
    }

    private static Locale inputContextLocale() {
        InputContext context = InputContext.getInstance();
        return context == null ? null : context.getLocale();
    }
}
