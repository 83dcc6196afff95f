package com.phillippitts.keycodes.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Optional information about a speedrun: the speedrun.com run id, platform, region,
 * emulator usage and custom variables. Empty strings mean "not specified".
 *
 * <p>Immutable value object; variables keep their insertion order.
 */
public final class RunMetadata {

    private final String runId;
    private final String platformName;
    private final boolean usesEmulator;
    private final String regionName;
    private final List<Variable> variables;

    /** A custom variable and its value, e.g. ("Difficulty", "Hard"). */
    public record Variable(String name, String value) {
        public Variable {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }
    }

    public RunMetadata(String runId, String platformName, boolean usesEmulator,
                       String regionName, Map<String, String> variables) {
        this.runId = runId == null ? "" : runId;
        this.platformName = platformName == null ? "" : platformName;
        this.usesEmulator = usesEmulator;
        this.regionName = regionName == null ? "" : regionName;
        List<Variable> vars = new ArrayList<>();
        if (variables != null) {
            new LinkedHashMap<>(variables).forEach((n, v) -> vars.add(new Variable(n, v)));
        }
        this.variables = Collections.unmodifiableList(vars);
    }

    public static RunMetadata empty() {
        return new RunMetadata("", "", false, "", Map.of());
    }

    /** speedrun.com run id this run is associated with; empty if none. */
    public String runId() {
        return runId;
    }

    public String platformName() {
        return platformName;
    }

    /** False may also mean the information is not known. */
    public boolean usesEmulator() {
        return usesEmulator;
    }

    public String regionName() {
        return regionName;
    }

    public List<Variable> variables() {
        return variables;
    }
}
