package com.phillippitts.keycodes.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KeyCodeMetricsTest {

    private MeterRegistry registry;
    private KeyCodeMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new KeyCodeMetrics(registry);
    }

    @Test
    void shouldCountUnrecognizedNamesPerSource() {
        metrics.recordUnrecognized("config");
        metrics.recordUnrecognized("config");
        metrics.recordUnrecognized("api");

        assertThat(count("keycodes.parse.unrecognized", "source", "config")).isEqualTo(2.0);
        assertThat(count("keycodes.parse.unrecognized", "source", "api")).isEqualTo(1.0);
    }

    @Test
    void shouldCountResolutionOutcome() {
        metrics.recordResolution(true);
        metrics.recordResolution(false);
        metrics.recordResolution(false);

        assertThat(count("keycodes.label.resolution", "outcome", "layout")).isEqualTo(1.0);
        assertThat(count("keycodes.label.resolution", "outcome", "baseline")).isEqualTo(2.0);
    }

    private double count(String name, String tag, String value) {
        Counter counter = registry.find(name).tag(tag, value).counter();
        assertThat(counter).isNotNull();
        return counter.count();
    }
}
