package org.resultparity.compare;

import java.util.List;
import java.util.Objects;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonString;

/**
 * A canonical key present on both sides whose records disagree on at least one field.
 */
public record CorruptedRecord(String canonicalKey, List<FieldMismatch> mismatches) {
    public CorruptedRecord {
        Objects.requireNonNull(canonicalKey, "canonicalKey");
        mismatches = List.copyOf(Objects.requireNonNull(mismatches, "mismatches"));
        if (mismatches.isEmpty()) {
            throw new IllegalArgumentException("mismatches must not be empty for corrupted records");
        }
    }

    public BsonDocument toDocument() {
        BsonArray fields = new BsonArray(mismatches.size());
        for (FieldMismatch mismatch : mismatches) {
            fields.add(mismatch.toDocument());
        }
        return new BsonDocument()
            .append("canonicalKey", new BsonString(canonicalKey))
            .append("mismatches", fields);
    }
}
