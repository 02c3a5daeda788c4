package org.resultparity.config;

import java.util.Locale;

/**
 * How the comparator treats a canonical key that occurs more than once on one side.
 */
public enum DuplicateKeyPolicy {
    /** Duplicates are listed in the report and fail parity. */
    REJECT("reject"),
    /** The later record silently replaces the earlier one. */
    LAST_WINS("last-wins");

    private final String value;

    DuplicateKeyPolicy(final String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static DuplicateKeyPolicy fromText(final String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new IllegalArgumentException("duplicateKeyPolicy must not be blank");
        }
        final String value = rawValue.trim().toLowerCase(Locale.ROOT);
        for (final DuplicateKeyPolicy policy : values()) {
            if (policy.value.equals(value)) {
                return policy;
            }
        }
        throw new IllegalArgumentException(
                "unsupported duplicateKeyPolicy: " + rawValue + " (expected: reject|last-wins)");
    }
}
