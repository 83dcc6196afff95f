package com.phillippitts.keycodes.config.hotkey;

import com.phillippitts.keycodes.service.hotkey.HotkeyBindings;
import com.phillippitts.keycodes.service.hotkey.HotkeyBindingsFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the effective hotkey bindings as a bean. The validator is a parameter so that
 * strict mode fails startup before any binding is parsed.
 */
@Configuration
public class HotkeyBindingsConfig {

    @Bean
    HotkeyBindings hotkeyBindings(HotkeyConfigurationValidator validator,
                                  HotkeyBindingsFactory factory,
                                  HotkeyProperties props) {
        return factory.from(props);
    }
}
