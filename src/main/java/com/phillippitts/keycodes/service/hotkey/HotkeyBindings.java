package com.phillippitts.keycodes.service.hotkey;

import com.phillippitts.keycodes.domain.KeyCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Effective hotkey bindings: action name to key. Immutable.
 * Serializing always uses canonical key codes, whatever spelling was configured.
 */
public final class HotkeyBindings {

    private final Map<String, KeyCode> bindings;
    private final List<String> ignoredActions;

    public HotkeyBindings(Map<String, KeyCode> bindings, List<String> ignoredActions) {
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
        this.ignoredActions = List.copyOf(ignoredActions);
    }

    public static HotkeyBindings empty() {
        return new HotkeyBindings(Map.of(), List.of());
    }

    public Optional<KeyCode> keyFor(String action) {
        return Optional.ofNullable(bindings.get(action));
    }

    /** @return the first action bound to the key, in configuration order */
    public Optional<String> actionFor(KeyCode key) {
        return bindings.entrySet().stream()
                .filter(e -> e.getValue() == key)
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public Map<String, KeyCode> asMap() {
        return bindings;
    }

    /** @return action name to canonical key code, in configuration order */
    public Map<String, String> toCanonical() {
        Map<String, String> out = new LinkedHashMap<>();
        bindings.forEach((action, key) -> out.put(action, key.code()));
        return Collections.unmodifiableMap(out);
    }

    /** @return actions dropped because their key was not recognized */
    public List<String> ignoredActions() {
        return ignoredActions;
    }

    public int size() {
        return bindings.size();
    }
}
