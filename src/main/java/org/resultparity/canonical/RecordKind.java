package org.resultparity.canonical;

/**
 * Node classification carried by a canonical record.
 */
public enum RecordKind {
    GROUP("Group"),
    STEP("Step"),
    MEASUREMENT("Measurement");

    /** Kind text used when an annotation omits the kind. */
    public static final String UNKNOWN_LABEL = "Unknown";

    private final String label;

    RecordKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
