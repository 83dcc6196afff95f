package com.phillippitts.keycodes.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Metrics for key name parsing and label resolution.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Unrecognized key names per source (config, api)</li>
 *   <li>Labels served from the keyboard layout versus the baseline table</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class KeyCodeMetrics {

    private static final String METRIC_PREFIX = "keycodes";

    private final MeterRegistry registry;

    public KeyCodeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Increments the unrecognized key name counter.
     *
     * @param source where the name came from (config, api)
     */
    public void recordUnrecognized(String source) {
        Counter.builder(METRIC_PREFIX + ".parse.unrecognized")
                .description("Key names matching no key code or alias")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    /**
     * Records where a display label came from.
     *
     * @param fromLayout true if the keyboard layout supplied the glyph
     */
    public void recordResolution(boolean fromLayout) {
        Counter.builder(METRIC_PREFIX + ".label.resolution")
                .description("Key labels by origin")
                .tag("outcome", fromLayout ? "layout" : "baseline")
                .register(registry)
                .increment();
    }
}
