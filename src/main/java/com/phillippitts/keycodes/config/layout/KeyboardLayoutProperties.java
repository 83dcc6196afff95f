package com.phillippitts.keycodes.config.layout;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed properties selecting the keyboard layout used for key labels.
 *
 * <pre>
 * keycodes.layout.source=standard
 * keycodes.layout.locale=de-DE
 * keycodes.layout.overrides.[Minus]=\u00DF
 * </pre>
 *
 * Overrides are keyed by canonical key code or alias and win over the selected source.
 * Keys are case-sensitive, so they need the bracket notation to survive relaxed binding.
 */
@Validated
@ConfigurationProperties(prefix = "keycodes.layout")
public class KeyboardLayoutProperties {

    /** Layout source. */
    @NotNull
    private final LayoutSource source;

    /** BCP 47 language tag for source=standard (e.g. en-US, de-DE, fr-FR). */
    private final String locale;

    /** Explicit glyphs per key, applied on top of the source. */
    private final Map<String, String> overrides;

    @ConstructorBinding
    public KeyboardLayoutProperties(LayoutSource source,
                                    String locale,
                                    Map<String, String> overrides) {
        this.source = source == null ? LayoutSource.NONE : source;
        this.locale = locale;
        this.overrides = overrides == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
    }

    public LayoutSource getSource() {
        return source;
    }

    public String getLocale() {
        return locale;
    }

    public Map<String, String> getOverrides() {
        return overrides;
    }
}
