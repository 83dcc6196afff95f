package com.phillippitts.keycodes.config.hotkey;

import com.phillippitts.keycodes.domain.KeyCodeParser;
import com.phillippitts.keycodes.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Validates HotkeyProperties at startup to fail fast with actionable messages.
 * Unrecognized keys are only fatal in strict mode.
 */
@Component
class HotkeyConfigurationValidator {

    private final HotkeyProperties props;

    HotkeyConfigurationValidator(HotkeyProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validate() {
        for (Map.Entry<String, String> e : props.getBindings().entrySet()) {
            if (e.getKey() == null || e.getKey().isBlank()) {
                throw new IllegalArgumentException("Invalid hotkey.bindings entry: action name must not be blank");
            }
            if (props.isStrict() && !KeyCodeParser.isKnown(e.getValue())) {
                throw new IllegalArgumentException("Invalid hotkey.bindings." + e.getKey() + ": '"
                        + LogSanitizer.truncate(e.getValue(), 64)
                        + "'. Must be a key code (KeyA, Digit1, F5, ArrowUp, ...) "
                        + "or an alias (A, 1, OSLeft, VolumeUp, ...). Matching is case-sensitive.");
            }
        }
    }
}
