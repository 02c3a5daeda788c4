package org.resultparity.compare;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.resultparity.canonical.CanonicalKeys;
import org.resultparity.canonical.CanonicalRecord;
import org.resultparity.canonical.Limits;
import org.resultparity.config.DuplicateKeyPolicy;

/**
 * Diffs two canonical arrays keyed by canonical key.
 *
 * <p>Reference keys missing from the subject are dropped, subject keys never consumed by the
 * reference pass are hallucinated, and keys present on both sides with any unequal field are
 * corrupted. Within one side a repeated key resolves to its last record; the repetition itself
 * is reported and, under {@link DuplicateKeyPolicy#REJECT}, fails parity.
 */
public final class ParityComparator {
    private final DuplicateKeyPolicy duplicateKeyPolicy;
    private final Clock clock;

    public ParityComparator() {
        this(DuplicateKeyPolicy.REJECT, Clock.systemUTC());
    }

    public ParityComparator(DuplicateKeyPolicy duplicateKeyPolicy, Clock clock) {
        this.duplicateKeyPolicy = Objects.requireNonNull(duplicateKeyPolicy, "duplicateKeyPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ParityReport compare(List<CanonicalRecord> reference, List<CanonicalRecord> subject) {
        return compare("reference", reference, "subject", subject);
    }

    public ParityReport compare(
        String referenceLabel,
        List<CanonicalRecord> reference,
        String subjectLabel,
        List<CanonicalRecord> subject
    ) {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(subject, "subject");

        Map<String, CanonicalRecord> referenceByKey = byKey(reference);
        Map<String, CanonicalRecord> remainingSubject = byKey(subject);

        List<CanonicalRecord> dropped = new ArrayList<>();
        List<CorruptedRecord> corrupted = new ArrayList<>();
        int matched = 0;
        for (Map.Entry<String, CanonicalRecord> entry : referenceByKey.entrySet()) {
            CanonicalRecord counterpart = remainingSubject.remove(entry.getKey());
            if (counterpart == null) {
                dropped.add(entry.getValue());
                continue;
            }
            List<FieldMismatch> mismatches = compareRecords(entry.getValue(), counterpart);
            if (mismatches.isEmpty()) {
                matched++;
            } else {
                corrupted.add(new CorruptedRecord(entry.getKey(), mismatches));
            }
        }
        List<CanonicalRecord> hallucinated = new ArrayList<>(remainingSubject.values());

        List<String> referenceDuplicates = duplicateKeyPolicy == DuplicateKeyPolicy.REJECT
            ? CanonicalKeys.duplicates(reference)
            : List.of();
        List<String> subjectDuplicates = duplicateKeyPolicy == DuplicateKeyPolicy.REJECT
            ? CanonicalKeys.duplicates(subject)
            : List.of();

        return new ParityReport(
            clock.instant(),
            referenceLabel,
            subjectLabel,
            reference.size(),
            subject.size(),
            matched,
            duplicateKeyPolicy,
            dropped,
            hallucinated,
            corrupted,
            referenceDuplicates,
            subjectDuplicates
        );
    }

    /**
     * Every compared field on which the two records disagree, in a fixed field order.
     */
    public static List<FieldMismatch> compareRecords(CanonicalRecord reference, CanonicalRecord subject) {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(subject, "subject");
        List<FieldMismatch> mismatches = new ArrayList<>();
        compareField("Path", reference.path(), subject.path(), mismatches);
        compareField(
            "ExecutionOrdinal",
            Integer.toString(reference.executionOrdinal()),
            Integer.toString(subject.executionOrdinal()),
            mismatches
        );
        compareField("Kind", reference.kind(), subject.kind(), mismatches);
        compareField("StepName", reference.stepName(), subject.stepName(), mismatches);
        compareField("Status", reference.status(), subject.status(), mismatches);
        compareField("Value", reference.value(), subject.value(), mismatches);
        compareField("Units", reference.units(), subject.units(), mismatches);
        compareField("Timestamp", reference.timestamp(), subject.timestamp(), mismatches);

        Limits left = reference.limits();
        Limits right = subject.limits();
        compareField("Limits.Low", left.low(), right.low(), mismatches);
        compareField("Limits.LowComp", left.lowComp(), right.lowComp(), mismatches);
        compareField("Limits.High", left.high(), right.high(), mismatches);
        compareField("Limits.HighComp", left.highComp(), right.highComp(), mismatches);
        compareField("Limits.Expected", left.expected(), right.expected(), mismatches);
        compareField("Limits.ExpectedComp", left.expectedComp(), right.expectedComp(), mismatches);
        return mismatches;
    }

    private static void compareField(String field, String left, String right, List<FieldMismatch> mismatches) {
        if (!FieldEquality.equal(left, right)) {
            mismatches.add(new FieldMismatch(field, left, right));
        }
    }

    private static Map<String, CanonicalRecord> byKey(List<CanonicalRecord> records) {
        Map<String, CanonicalRecord> indexed = new LinkedHashMap<>();
        for (CanonicalRecord record : records) {
            indexed.put(record.canonicalKey(), record);
        }
        return indexed;
    }
}
