package com.phillippitts.keycodes.presentation.controller;

import com.phillippitts.keycodes.domain.KeyCode;
import com.phillippitts.keycodes.domain.KeyCodeClass;
import com.phillippitts.keycodes.domain.KeyCodeParser;
import com.phillippitts.keycodes.exception.UnknownKeyCodeException;
import com.phillippitts.keycodes.layout.KeyLabelResolver;
import com.phillippitts.keycodes.service.hotkey.HotkeyBindings;
import com.phillippitts.keycodes.service.metrics.KeyCodeMetrics;
import com.phillippitts.keycodes.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only key catalogue for hotkey pickers: keys grouped by class with their
 * baseline and layout-aware labels, plus the effective hotkey bindings.
 */
@RestController
@RequestMapping("/api")
class KeyCodeController {

    private static final Logger LOG = LogManager.getLogger(KeyCodeController.class);

    private final KeyLabelResolver resolver;
    private final HotkeyBindings bindings;
    private final KeyCodeMetrics metrics;

    KeyCodeController(KeyLabelResolver resolver, HotkeyBindings bindings, KeyCodeMetrics metrics) {
        this.resolver = resolver;
        this.bindings = bindings;
        this.metrics = metrics;
    }

    /** Response shape for a single key. */
    record KeyView(String code, String keyClass, String label, String displayLabel, List<String> aliases) {}

    @GetMapping("/keys")
    ResponseEntity<Map<String, List<KeyView>>> keys() {
        Map<String, List<KeyView>> grouped = new LinkedHashMap<>();
        for (KeyCodeClass c : KeyCodeClass.values()) {
            grouped.put(c.name(), c.members().stream().map(this::view).toList());
        }
        return ResponseEntity.ok(grouped);
    }

    @GetMapping("/keys/classes")
    ResponseEntity<Map<String, Integer>> classes() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (KeyCodeClass c : KeyCodeClass.values()) {
            counts.put(c.name(), c.members().size());
        }
        return ResponseEntity.ok(counts);
    }

    @GetMapping("/keys/{name}")
    ResponseEntity<KeyView> key(@PathVariable("name") String name) {
        KeyCode key = KeyCodeParser.parse(name).orElseThrow(() -> {
            metrics.recordUnrecognized("api");
            return new UnknownKeyCodeException(name);
        });
        if (!key.code().equals(name)) {
            LOG.debug("Alias '{}' resolved to {}", LogSanitizer.forLog(name, 64), key.code());
        }
        return ResponseEntity.ok(view(key));
    }

    @GetMapping("/hotkeys")
    ResponseEntity<Map<String, String>> hotkeys() {
        return ResponseEntity.ok(bindings.toCanonical());
    }

    private KeyView view(KeyCode key) {
        KeyLabelResolver.Resolution r = resolver.resolveDetailed(key);
        metrics.recordResolution(r.fromLayout());
        return new KeyView(key.code(), key.classify().name(), key.label(), r.label(),
                KeyCodeParser.aliasesOf(key));
    }
}
