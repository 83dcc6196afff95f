package com.phillippitts.keycodes.service.hotkey;

import com.phillippitts.keycodes.config.hotkey.HotkeyProperties;
import com.phillippitts.keycodes.domain.KeyCode;
import com.phillippitts.keycodes.domain.KeyCodeParser;
import com.phillippitts.keycodes.service.metrics.KeyCodeMetrics;
import com.phillippitts.keycodes.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds {@link HotkeyBindings} from persisted key names.
 * Unknown names are dropped with a warning and counted. Strict mode is enforced earlier,
 * by the startup validator in {@code config.hotkey}, so it never reaches this factory
 * with an unknown name.
 */
@Component
public class HotkeyBindingsFactory {

    private static final Logger LOG = LogManager.getLogger(HotkeyBindingsFactory.class);

    private final KeyCodeMetrics metrics;

    public HotkeyBindingsFactory(KeyCodeMetrics metrics) {
        this.metrics = metrics;
    }

    public HotkeyBindings from(HotkeyProperties props) {
        Map<String, KeyCode> bound = new LinkedHashMap<>();
        List<String> ignored = new ArrayList<>();
        for (Map.Entry<String, String> e : props.getBindings().entrySet()) {
            String action = e.getKey();
            Optional<KeyCode> key = KeyCodeParser.parse(e.getValue());
            if (key.isEmpty()) {
                metrics.recordUnrecognized("config");
                LOG.warn("Ignoring hotkey binding '{}': unknown key '{}'",
                        LogSanitizer.forLog(action, 64), LogSanitizer.forLog(e.getValue(), 64));
                ignored.add(action);
                continue;
            }
            bound.values().stream()
                    .filter(k -> k == key.get())
                    .findFirst()
                    .ifPresent(k -> LOG.warn("Key {} is bound to more than one action, including '{}'",
                            k.code(), LogSanitizer.forLog(action, 64)));
            bound.put(action, key.get());
        }
        LOG.info("Loaded {} hotkey binding(s), ignored {}", bound.size(), ignored.size());
        return new HotkeyBindings(bound, ignored);
    }
}
