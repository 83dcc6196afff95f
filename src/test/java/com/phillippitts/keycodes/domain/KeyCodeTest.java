package com.phillippitts.keycodes.domain;

import com.phillippitts.keycodes.exception.UnknownKeyCodeException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyCodeTest {

    @ParameterizedTest
    @EnumSource(KeyCode.class)
    void everyKeyHasClassAndNonEmptyLabel(KeyCode key) {
        assertThat(key.classify()).isNotNull();
        assertThat(key.label()).isNotEmpty();
        assertThat(key.code()).isNotBlank();
    }

    @Test
    void classesPartitionTheKeySet() {
        List<KeyCode> all = new ArrayList<>();
        for (KeyCodeClass c : KeyCodeClass.values()) {
            assertThat(c.members()).as("members of %s", c).isNotEmpty();
            all.addAll(c.members());
        }
        assertThat(all).hasSize(KeyCode.values().length);
        assertThat(new HashSet<>(all)).containsExactlyInAnyOrder(KeyCode.values());
    }

    @Test
    void classSizesMatchTheStandardSections() {
        Map<KeyCodeClass, Integer> sizes = new EnumMap<>(KeyCodeClass.class);
        for (KeyCodeClass c : KeyCodeClass.values()) {
            sizes.put(c, c.members().size());
        }
        assertThat(KeyCode.values()).hasSize(214);
        assertThat(sizes).containsEntry(KeyCodeClass.WRITING_SYSTEM, 51)
                .containsEntry(KeyCodeClass.FUNCTIONAL, 21)
                .containsEntry(KeyCodeClass.CONTROL_PAD, 7)
                .containsEntry(KeyCodeClass.ARROW_PAD, 4)
                .containsEntry(KeyCodeClass.NUMPAD, 31)
                .containsEntry(KeyCodeClass.FUNCTION, 30)
                .containsEntry(KeyCodeClass.MEDIA, 22)
                .containsEntry(KeyCodeClass.LEGACY, 9)
                .containsEntry(KeyCodeClass.GAMEPAD, 20)
                .containsEntry(KeyCodeClass.NON_STANDARD, 19);
    }

    @Test
    void classifiesRepresentativeKeys() {
        assertThat(KeyCode.KEY_A.classify()).isEqualTo(KeyCodeClass.WRITING_SYSTEM);
        assertThat(KeyCode.F5.classify()).isEqualTo(KeyCodeClass.FUNCTION);
        assertThat(KeyCode.GAMEPAD_10.classify()).isEqualTo(KeyCodeClass.GAMEPAD);
        assertThat(KeyCode.ARROW_UP.classify()).isEqualTo(KeyCodeClass.ARROW_PAD);
    }

    @Test
    void keepsSectionBoundariesOfTheStandard() {
        assertThat(KeyCode.BACKSPACE.classify()).isEqualTo(KeyCodeClass.WRITING_SYSTEM);
        assertThat(KeyCode.INTL_YEN.classify()).isEqualTo(KeyCodeClass.WRITING_SYSTEM);
        assertThat(KeyCode.SPACE.classify()).isEqualTo(KeyCodeClass.FUNCTIONAL);
        assertThat(KeyCode.META_LEFT.classify()).isEqualTo(KeyCodeClass.FUNCTIONAL);
        assertThat(KeyCode.LANG_1.classify()).isEqualTo(KeyCodeClass.FUNCTIONAL);
        assertThat(KeyCode.ESCAPE.classify()).isEqualTo(KeyCodeClass.FUNCTION);
        assertThat(KeyCode.PAUSE.classify()).isEqualTo(KeyCodeClass.FUNCTION);
        assertThat(KeyCode.NUM_LOCK.classify()).isEqualTo(KeyCodeClass.NUMPAD);
        assertThat(KeyCode.POWER.classify()).isEqualTo(KeyCodeClass.MEDIA);
        assertThat(KeyCode.COPY.classify()).isEqualTo(KeyCodeClass.LEGACY);
        assertThat(KeyCode.MEDIA_PLAY.classify()).isEqualTo(KeyCodeClass.NON_STANDARD);
        assertThat(KeyCode.MEDIA_PLAY_PAUSE.classify()).isEqualTo(KeyCodeClass.MEDIA);
    }

    @Test
    void labelsUseUsLayoutAndPictograms() {
        assertThat(KeyCode.BACKQUOTE.label()).isEqualTo("`");
        assertThat(KeyCode.BACKSLASH.label()).isEqualTo("\\");
        assertThat(KeyCode.KEY_Q.label()).isEqualTo("Q");
        assertThat(KeyCode.DIGIT_7.label()).isEqualTo("7");
        assertThat(KeyCode.ARROW_UP.label()).isEqualTo("↑");
        assertThat(KeyCode.ENTER.label()).isEqualTo("↵");
        assertThat(KeyCode.META_LEFT.label()).isEqualTo("⌘ Left");
        assertThat(KeyCode.AUDIO_VOLUME_UP.label()).isEqualTo("🔊");
        assertThat(KeyCode.NUMPAD_STAR.label()).isEqualTo("Numpad * (Star)");
        assertThat(KeyCode.PAUSE.label()).isEqualTo("Pause Break");
        assertThat(KeyCode.GAMEPAD_19.label()).isEqualTo("Gamepad 19");
    }

    @Test
    void canonicalNamesAreUnique() {
        Set<String> codes = new HashSet<>();
        Arrays.stream(KeyCode.values()).forEach(k -> assertThat(codes.add(k.code())).as(k.code()).isTrue());
    }

    @Test
    void toStringIsTheCanonicalName() {
        assertThat(KeyCode.KEY_A).hasToString("KeyA");
        assertThat(KeyCode.DIGIT_0).hasToString("Digit0");
        assertThat(KeyCode.DISPLAY_TOGGLE_INT_EXT).hasToString("DisplayToggleIntExt");
        assertThat(KeyCode.LAUNCH_APP_1).hasToString("LaunchApp1");
    }

    @Test
    void fromCodeAcceptsAliasesAndRejectsUnknownText() {
        assertThat(KeyCode.fromCode("OSRight")).isEqualTo(KeyCode.META_RIGHT);
        assertThatThrownBy(() -> KeyCode.fromCode("NotARealKey"))
                .isInstanceOf(UnknownKeyCodeException.class)
                .hasMessageContaining("NotARealKey");
    }
}
