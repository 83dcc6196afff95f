package com.phillippitts.keycodes.domain;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunMetadataTest {

    @Test
    void exposesFieldsAndVariablesInOrder() {
        Map<String, String> vars = new LinkedHashMap<>();
        vars.put("Difficulty", "Hard");
        vars.put("Version", "1.0");
        vars.put("Category Extensions", "");

        RunMetadata m = new RunMetadata("8y23k2my", "Nintendo 64", true, "NTSC-J", vars);

        assertThat(m.runId()).isEqualTo("8y23k2my");
        assertThat(m.platformName()).isEqualTo("Nintendo 64");
        assertThat(m.usesEmulator()).isTrue();
        assertThat(m.regionName()).isEqualTo("NTSC-J");
        assertThat(m.variables()).containsExactly(
                new RunMetadata.Variable("Difficulty", "Hard"),
                new RunMetadata.Variable("Version", "1.0"),
                new RunMetadata.Variable("Category Extensions", ""));
    }

    @Test
    void missingValuesBecomeEmpty() {
        RunMetadata m = new RunMetadata(null, null, false, null, null);

        assertThat(m.runId()).isEmpty();
        assertThat(m.platformName()).isEmpty();
        assertThat(m.regionName()).isEmpty();
        assertThat(m.variables()).isEmpty();
        assertThat(RunMetadata.empty().variables()).isEmpty();
    }

    @Test
    void variablesAreUnmodifiable() {
        RunMetadata m = new RunMetadata("", "", false, "", Map.of("a", "b"));

        assertThatThrownBy(() -> m.variables().add(new RunMetadata.Variable("c", "d")))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
