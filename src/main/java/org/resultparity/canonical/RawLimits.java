package org.resultparity.canonical;

import java.util.List;
import java.util.Objects;

/**
 * Limit data of one measurement as found in the source document.
 *
 * @param candidates limit-pair or single-limit entries in document order
 * @param expected the expected-value entry, or {@code null}
 */
public record RawLimits(List<LimitEntry> candidates, LimitEntry expected) {
    private static final RawLimits ABSENT = new RawLimits(List.of(), null);

    public RawLimits {
        candidates = List.copyOf(Objects.requireNonNull(candidates, "candidates"));
    }

    public static RawLimits absent() {
        return ABSENT;
    }

    public boolean isAbsent() {
        return candidates.isEmpty() && expected == null;
    }
}
