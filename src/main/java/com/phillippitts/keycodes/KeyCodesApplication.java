package com.phillippitts.keycodes;

import com.phillippitts.keycodes.config.hotkey.HotkeyProperties;
import com.phillippitts.keycodes.config.layout.KeyboardLayoutProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        KeyboardLayoutProperties.class,
        HotkeyProperties.class
})
public class KeyCodesApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(KeyCodesApplication.class);
        // SpringApplication defaults to headless; the input-locale layout source needs AWT.
        app.setHeadless(false);
        app.run(args);
    }

}
