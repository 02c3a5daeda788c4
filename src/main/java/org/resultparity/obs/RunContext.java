package org.resultparity.obs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Run metadata emitted with every structured log event.
 */
public final class RunContext {
    private final String runId;
    private final String stage;
    private final String input;

    private RunContext(Builder builder) {
        this.runId = requireText(builder.runId, "runId");
        this.stage = requireText(builder.stage, "stage");
        this.input = normalize(builder.input);
    }

    public static RunContext of(String runId, String stage) {
        return builder(runId, stage).build();
    }

    public static RunContext newRun(String stage) {
        return of(UUID.randomUUID().toString(), stage);
    }

    public static Builder builder(String runId, String stage) {
        return new Builder(runId, stage);
    }

    public String runId() {
        return runId;
    }

    public String stage() {
        return stage;
    }

    public Optional<String> input() {
        return Optional.ofNullable(input);
    }

    /**
     * Same run, different pipeline stage.
     */
    public RunContext withStage(String nextStage) {
        return builder(runId, nextStage).input(input).build();
    }

    public RunContext withInput(String nextInput) {
        return builder(runId, stage).input(nextInput).build();
    }

    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("runId", runId);
        fields.put("stage", stage);
        if (input != null) {
            fields.put("input", input);
        }
        return fields;
    }

    private static String requireText(String value, String fieldName) {
        String normalized = normalize(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private final String runId;
        private final String stage;
        private String input;

        private Builder(String runId, String stage) {
            this.runId = Objects.requireNonNull(runId, "runId");
            this.stage = Objects.requireNonNull(stage, "stage");
        }

        public Builder input(String input) {
            this.input = input;
            return this;
        }

        public RunContext build() {
            return new RunContext(this);
        }
    }
}
