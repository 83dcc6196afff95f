package com.phillippitts.keycodes.layout;

import com.phillippitts.keycodes.domain.KeyCode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FixedKeyboardLayoutTest {

    @Test
    void answersFromTableThenFallback() {
        FixedKeyboardLayout layout = new FixedKeyboardLayout("overrides",
                Map.of(KeyCode.MINUS, "ß"), StandardLayout.US.layout());

        assertThat(layout.glyphFor(KeyCode.MINUS)).contains("ß");
        assertThat(layout.glyphFor(KeyCode.KEY_A)).contains("a");
        assertThat(layout.glyphFor(KeyCode.F1)).isEmpty();
        assertThat(layout.size()).isEqualTo(1);
    }

    @Test
    void withoutFallbackUnknownKeysAreEmpty() {
        FixedKeyboardLayout layout = new FixedKeyboardLayout("single", Map.of(KeyCode.KEY_A, "q"));

        assertThat(layout.glyphFor(KeyCode.KEY_B)).isEmpty();
        assertThat(layout).hasToString("single");
    }

    @Test
    void rejectsEmptyGlyphs() {
        assertThatThrownBy(() -> new FixedKeyboardLayout("bad", Map.of(KeyCode.KEY_A, "")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("KeyA");
    }

    @Test
    void rejectsBlankName() {
        assertThatThrownBy(() -> new FixedKeyboardLayout(" ", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
