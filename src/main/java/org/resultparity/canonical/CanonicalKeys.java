package org.resultparity.canonical;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Canonical key checks over a record array.
 */
public final class CanonicalKeys {
    private CanonicalKeys() {
    }

    /**
     * Keys that occur more than once, in order of their second occurrence.
     */
    public static List<String> duplicates(List<CanonicalRecord> records) {
        Objects.requireNonNull(records, "records");
        Set<String> seen = new HashSet<>();
        Set<String> repeated = new LinkedHashSet<>();
        for (CanonicalRecord record : records) {
            if (!seen.add(record.canonicalKey())) {
                repeated.add(record.canonicalKey());
            }
        }
        return List.copyOf(new ArrayList<>(repeated));
    }
}
