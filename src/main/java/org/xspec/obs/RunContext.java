package org.xspec.obs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Correlation metadata emitted with every structured log event of one spec run.
 */
public final class RunContext {
    private final String runId;
    private final String mode;
    private final String root;
    private final Integer scenario;

    private RunContext(Builder builder) {
        this.runId = requireText(builder.runId, "runId");
        this.mode = requireText(builder.mode, "mode");
        this.root = Objects.requireNonNull(builder.root, "root");
        this.scenario = builder.scenario;
    }

    public static RunContext of(String runId, String mode, String root) {
        return builder(runId, mode, root).build();
    }

    public static Builder builder(String runId, String mode, String root) {
        return new Builder(runId, mode, root);
    }

    public String runId() {
        return runId;
    }

    public String mode() {
        return mode;
    }

    public String root() {
        return root;
    }

    public Optional<Integer> scenario() {
        return Optional.ofNullable(scenario);
    }

    public RunContext withScenario(int scenarioIndex) {
        return builder(runId, mode, root).scenario(scenarioIndex).build();
    }

    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("runId", runId);
        fields.put("mode", mode);
        fields.put("root", root);
        if (scenario != null) {
            fields.put("scenario", scenario);
        }
        return fields;
    }

    private static String requireText(String value, String fieldName) {
        String normalized = value == null ? null : value.trim();
        if (normalized == null || normalized.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    public static final class Builder {
        private final String runId;
        private final String mode;
        private final String root;
        private Integer scenario;

        private Builder(String runId, String mode, String root) {
            this.runId = Objects.requireNonNull(runId, "runId");
            this.mode = Objects.requireNonNull(mode, "mode");
            this.root = Objects.requireNonNull(root, "root");
        }

        public Builder scenario(Integer scenario) {
            if (scenario != null && scenario < 0) {
                throw new IllegalArgumentException("scenario must be >= 0");
            }
            this.scenario = scenario;
            return this;
        }

        public RunContext build() {
            return new RunContext(this);
        }
    }
}
