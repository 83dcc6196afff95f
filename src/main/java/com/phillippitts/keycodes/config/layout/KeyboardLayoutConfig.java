package com.phillippitts.keycodes.config.layout;

import com.phillippitts.keycodes.domain.KeyCode;
import com.phillippitts.keycodes.domain.KeyCodeClass;
import com.phillippitts.keycodes.domain.KeyCodeParser;
import com.phillippitts.keycodes.layout.AwtInputLocaleSource;
import com.phillippitts.keycodes.layout.FixedKeyboardLayout;
import com.phillippitts.keycodes.layout.GuardedKeyboardLayout;
import com.phillippitts.keycodes.layout.InputLocaleKeyboardLayout;
import com.phillippitts.keycodes.layout.KeyLabelResolver;
import com.phillippitts.keycodes.layout.KeyboardLayout;
import com.phillippitts.keycodes.layout.NoKeyboardLayout;
import com.phillippitts.keycodes.layout.StandardLayout;
import com.phillippitts.keycodes.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Builds the {@link KeyboardLayout} and {@link KeyLabelResolver} beans from
 * {@link KeyboardLayoutProperties}. Invalid settings fail startup with an actionable message.
 */
@Configuration
public class KeyboardLayoutConfig {

    private static final Logger LOG = LogManager.getLogger(KeyboardLayoutConfig.class);

    @Bean
    public KeyboardLayout keyboardLayout(KeyboardLayoutProperties props) {
        KeyboardLayout layout = buildLayout(props, new AwtInputLocaleSource());
        LOG.info("Keyboard layout for key labels: {}", layout);
        return layout;
    }

    @Bean
    public KeyLabelResolver keyLabelResolver(KeyboardLayout keyboardLayout) {
        return new KeyLabelResolver(keyboardLayout);
    }

    static KeyboardLayout buildLayout(KeyboardLayoutProperties props,
                                      Supplier<Optional<Locale>> inputLocaleSource) {
        KeyboardLayout base = switch (props.getSource()) {
            case NONE -> NoKeyboardLayout.INSTANCE;
            case INPUT_LOCALE -> GuardedKeyboardLayout.wrap(new InputLocaleKeyboardLayout(inputLocaleSource));
            case STANDARD -> standardLayout(props.getLocale()).layout();
        };
        if (props.getOverrides().isEmpty()) {
            return base;
        }
        return new FixedKeyboardLayout("overrides", parseOverrides(props.getOverrides()), base);
    }

    private static StandardLayout standardLayout(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException(
                    "keycodes.layout.source=standard requires keycodes.layout.locale (e.g. de-DE)");
        }
        return StandardLayout.forLocale(Locale.forLanguageTag(tag))
                .orElseThrow(() -> new IllegalArgumentException("Invalid keycodes.layout.locale: '"
                        + LogSanitizer.truncate(tag, 32) + "'. Known layouts: "
                        + Arrays.toString(StandardLayout.values())));
    }

    private static Map<KeyCode, String> parseOverrides(Map<String, String> raw) {
        Map<KeyCode, String> glyphs = new EnumMap<>(KeyCode.class);
        raw.forEach((name, glyph) -> {
            KeyCode key = KeyCodeParser.parse(name).orElseThrow(() -> new IllegalArgumentException(
                    "Invalid keycodes.layout.overrides key: '" + LogSanitizer.truncate(name, 64)
                            + "'. Must be a key code such as KeyQ, Digit1 or Minus."));
            if (key.classify() != KeyCodeClass.WRITING_SYSTEM) {
                throw new IllegalArgumentException("keycodes.layout.overrides." + key.code()
                        + " is not a writing system key; its label does not depend on the layout");
            }
            if (glyph == null || glyph.isEmpty()) {
                throw new IllegalArgumentException("keycodes.layout.overrides." + key.code()
                        + " must not be empty");
            }
            glyphs.put(key, glyph);
        });
        return glyphs;
    }
}
