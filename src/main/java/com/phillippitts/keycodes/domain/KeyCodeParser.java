package com.phillippitts.keycodes.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves key names from configuration files and native hooks to {@link KeyCode}s.
 *
 * <p>Accepts the canonical name of every key plus a fixed set of aliases:
 * <ul>
 *   <li>single letters and digits ({@code "A"}, {@code "7"}) for the letter and digit row keys</li>
 *   <li>{@code OSLeft}/{@code OSRight} for the meta keys</li>
 *   <li>{@code VolumeUp}/{@code VolumeDown}/{@code VolumeMute} for the audio volume keys</li>
 *   <li>{@code LaunchMediaPlayer} for the media select key</li>
 * </ul>
 * Matching is exact: no trimming and no case folding. Aliases are accepted on input only;
 * a key is always written back with {@link KeyCode#code()}.
 */
public final class KeyCodeParser {

    private static final Map<String, KeyCode> BY_NAME;
    private static final Map<KeyCode, List<String>> ALIASES;

    static {
        Map<String, KeyCode> names = new HashMap<>();
        for (KeyCode k : KeyCode.values()) {
            register(names, k.code(), k);
        }

        Map<KeyCode, List<String>> aliases = new EnumMap<>(KeyCode.class);
        for (char c = 'A'; c <= 'Z'; c++) {
            addAlias(aliases, KeyCode.valueOf("KEY_" + c), String.valueOf(c));
        }
        for (char c = '0'; c <= '9'; c++) {
            addAlias(aliases, KeyCode.valueOf("DIGIT_" + c), String.valueOf(c));
        }
        addAlias(aliases, KeyCode.META_LEFT, "OSLeft");
        addAlias(aliases, KeyCode.META_RIGHT, "OSRight");
        addAlias(aliases, KeyCode.AUDIO_VOLUME_DOWN, "VolumeDown");
        addAlias(aliases, KeyCode.AUDIO_VOLUME_MUTE, "VolumeMute");
        addAlias(aliases, KeyCode.AUDIO_VOLUME_UP, "VolumeUp");
        addAlias(aliases, KeyCode.MEDIA_SELECT, "LaunchMediaPlayer");

        aliases.forEach((k, list) -> list.forEach(alias -> register(names, alias, k)));

        BY_NAME = Map.copyOf(names);
        ALIASES = Collections.unmodifiableMap(aliases);
    }

    private KeyCodeParser() {}

    private static void register(Map<String, KeyCode> names, String name, KeyCode key) {
        KeyCode previous = names.putIfAbsent(name, key);
        if (previous != null) {
            throw new IllegalStateException("Key name '" + name + "' is claimed by both "
                    + previous.name() + " and " + key.name());
        }
    }

    private static void addAlias(Map<KeyCode, List<String>> aliases, KeyCode key, String alias) {
        aliases.computeIfAbsent(key, k -> new ArrayList<>()).add(alias);
    }

    /**
     * @param text canonical name or alias; {@code null} is treated as unrecognized
     * @return the matching key, or empty if the text is not recognized
     */
    public static Optional<KeyCode> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(text));
    }

    /** @return true if {@link #parse(String)} recognizes the text */
    public static boolean isKnown(String text) {
        return parse(text).isPresent();
    }

    /** @return the non-canonical spellings accepted for the key, possibly empty */
    public static List<String> aliasesOf(KeyCode key) {
        return List.copyOf(ALIASES.getOrDefault(key, List.of()));
    }

    /** @return every spelling the parser accepts, canonical names included */
    public static Map<String, KeyCode> acceptedNames() {
        return BY_NAME;
    }
}
