package com.phillippitts.keycodes.config.hotkey;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed properties for persisted hotkey bindings.
 *
 * <pre>
 * hotkey.bindings.split=Numpad1
 * hotkey.bindings.reset=OSLeft
 * hotkey.strict=false
 * </pre>
 *
 * Values are key codes or accepted aliases. In strict mode an unrecognized key fails
 * startup; otherwise the binding is dropped with a warning.
 */
@Validated
@ConfigurationProperties(prefix = "hotkey")
public class HotkeyProperties {

    /** Action name to key text. */
    private final Map<String, String> bindings;

    /** Reject unrecognized keys at startup instead of ignoring them. */
    private final boolean strict;

    @ConstructorBinding
    public HotkeyProperties(Map<String, String> bindings, Boolean strict) {
        this.bindings = bindings == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
        this.strict = strict != null && strict;
    }

    public Map<String, String> getBindings() {
        return bindings;
    }

    public boolean isStrict() {
        return strict;
    }
}
