package org.resultparity.compare;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.resultparity.canonical.CanonicalRecord;
import org.resultparity.config.DuplicateKeyPolicy;

/**
 * Outcome of comparing a reference canonical array against a subject array.
 */
public final class ParityReport {
    private final Instant generatedAt;
    private final String referenceLabel;
    private final String subjectLabel;
    private final int referenceCount;
    private final int subjectCount;
    private final int matchedCount;
    private final DuplicateKeyPolicy duplicateKeyPolicy;
    private final List<CanonicalRecord> dropped;
    private final List<CanonicalRecord> hallucinated;
    private final List<CorruptedRecord> corrupted;
    private final List<String> referenceDuplicateKeys;
    private final List<String> subjectDuplicateKeys;

    ParityReport(
        Instant generatedAt,
        String referenceLabel,
        String subjectLabel,
        int referenceCount,
        int subjectCount,
        int matchedCount,
        DuplicateKeyPolicy duplicateKeyPolicy,
        List<CanonicalRecord> dropped,
        List<CanonicalRecord> hallucinated,
        List<CorruptedRecord> corrupted,
        List<String> referenceDuplicateKeys,
        List<String> subjectDuplicateKeys
    ) {
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt");
        this.referenceLabel = requireText(referenceLabel, "referenceLabel");
        this.subjectLabel = requireText(subjectLabel, "subjectLabel");
        this.referenceCount = referenceCount;
        this.subjectCount = subjectCount;
        this.matchedCount = matchedCount;
        this.duplicateKeyPolicy = Objects.requireNonNull(duplicateKeyPolicy, "duplicateKeyPolicy");
        this.dropped = List.copyOf(Objects.requireNonNull(dropped, "dropped"));
        this.hallucinated = List.copyOf(Objects.requireNonNull(hallucinated, "hallucinated"));
        this.corrupted = List.copyOf(Objects.requireNonNull(corrupted, "corrupted"));
        this.referenceDuplicateKeys = List.copyOf(Objects.requireNonNull(referenceDuplicateKeys, "referenceDuplicateKeys"));
        this.subjectDuplicateKeys = List.copyOf(Objects.requireNonNull(subjectDuplicateKeys, "subjectDuplicateKeys"));
    }

    public Instant generatedAt() {
        return generatedAt;
    }

    public String referenceLabel() {
        return referenceLabel;
    }

    public String subjectLabel() {
        return subjectLabel;
    }

    public int referenceCount() {
        return referenceCount;
    }

    public int subjectCount() {
        return subjectCount;
    }

    public DuplicateKeyPolicy duplicateKeyPolicy() {
        return duplicateKeyPolicy;
    }

    /**
     * Reference records with no subject record under the same key.
     */
    public List<CanonicalRecord> dropped() {
        return dropped;
    }

    /**
     * Subject records with no reference record under the same key, in subject order.
     */
    public List<CanonicalRecord> hallucinated() {
        return hallucinated;
    }

    public List<CorruptedRecord> corrupted() {
        return corrupted;
    }

    public List<String> referenceDuplicateKeys() {
        return referenceDuplicateKeys;
    }

    public List<String> subjectDuplicateKeys() {
        return subjectDuplicateKeys;
    }

    /**
     * Keys present on both sides with every compared field equal.
     */
    public int matchedCount() {
        return matchedCount;
    }

    public boolean hasDuplicateKeys() {
        return !referenceDuplicateKeys.isEmpty() || !subjectDuplicateKeys.isEmpty();
    }

    /**
     * Parity holds when nothing was dropped, hallucinated or corrupted and, under
     * {@link DuplicateKeyPolicy#REJECT}, neither side repeats a key.
     */
    public boolean passed() {
        boolean duplicatesFail = duplicateKeyPolicy == DuplicateKeyPolicy.REJECT && hasDuplicateKeys();
        return dropped.isEmpty() && hallucinated.isEmpty() && corrupted.isEmpty() && !duplicatesFail;
    }

    public BsonDocument toDocument() {
        BsonDocument summary = new BsonDocument()
            .append("reference", new BsonInt32(referenceCount))
            .append("subject", new BsonInt32(subjectCount))
            .append("matched", new BsonInt32(matchedCount))
            .append("dropped", new BsonInt32(dropped.size()))
            .append("hallucinated", new BsonInt32(hallucinated.size()))
            .append("corrupted", new BsonInt32(corrupted.size()))
            .append("referenceDuplicateKeys", new BsonInt32(referenceDuplicateKeys.size()))
            .append("subjectDuplicateKeys", new BsonInt32(subjectDuplicateKeys.size()));

        BsonArray droppedItems = new BsonArray(dropped.size());
        for (CanonicalRecord record : dropped) {
            droppedItems.add(record.toDocument());
        }
        BsonArray hallucinatedItems = new BsonArray(hallucinated.size());
        for (CanonicalRecord record : hallucinated) {
            hallucinatedItems.add(record.toDocument());
        }
        BsonArray corruptedItems = new BsonArray(corrupted.size());
        for (CorruptedRecord record : corrupted) {
            corruptedItems.add(record.toDocument());
        }

        return new BsonDocument()
            .append("generatedAt", new BsonString(generatedAt.toString()))
            .append("reference", new BsonString(referenceLabel))
            .append("subject", new BsonString(subjectLabel))
            .append("duplicateKeyPolicy", new BsonString(duplicateKeyPolicy.value()))
            .append("passed", BsonBoolean.valueOf(passed()))
            .append("summary", summary)
            .append("dropped", droppedItems)
            .append("hallucinated", hallucinatedItems)
            .append("corrupted", corruptedItems)
            .append("referenceDuplicateKeys", stringArray(referenceDuplicateKeys))
            .append("subjectDuplicateKeys", stringArray(subjectDuplicateKeys));
    }

    private static BsonArray stringArray(List<String> values) {
        BsonArray array = new BsonArray(values.size());
        for (String value : values) {
            array.add(new BsonString(value));
        }
        return array;
    }

    private static String requireText(String value, String fieldName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.trim();
    }
}
