package org.resultparity.canonical;

import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;

/**
 * Normalized representation of one group, step or measurement.
 *
 * <p>String fields are never {@code null}; absent values are carried as the empty string.
 */
public record CanonicalRecord(
    String canonicalKey,
    int executionOrdinal,
    String path,
    String kind,
    String stepName,
    String status,
    String value,
    String units,
    Limits limits,
    String timestamp
) {
    public static final String KEY_SEPARATOR = "|";

    public CanonicalRecord {
        Objects.requireNonNull(canonicalKey, "canonicalKey");
        if (canonicalKey.isEmpty()) {
            throw new IllegalArgumentException("canonicalKey must not be empty");
        }
        if (executionOrdinal < 1) {
            throw new IllegalArgumentException("executionOrdinal must be positive: " + executionOrdinal);
        }
        path = orEmpty(path);
        kind = orEmpty(kind);
        stepName = orEmpty(stepName);
        status = orEmpty(status);
        value = orEmpty(value);
        units = orEmpty(units);
        limits = limits == null ? Limits.none() : limits;
        timestamp = orEmpty(timestamp);
    }

    /**
     * Builds a record whose key is derived from {@code path} and {@code executionOrdinal}.
     */
    public static CanonicalRecord of(
        String path,
        int executionOrdinal,
        String kind,
        String stepName,
        String status,
        String value,
        String units,
        Limits limits,
        String timestamp
    ) {
        return new CanonicalRecord(
            keyOf(path, executionOrdinal),
            executionOrdinal,
            path,
            kind,
            stepName,
            status,
            value,
            units,
            limits,
            timestamp
        );
    }

    public static String keyOf(String path, int executionOrdinal) {
        return orEmpty(path) + KEY_SEPARATOR + executionOrdinal;
    }

    public BsonDocument toDocument() {
        return new BsonDocument()
            .append("CanonicalKey", new BsonString(canonicalKey))
            .append("ExecutionOrdinal", new BsonInt32(executionOrdinal))
            .append("Path", new BsonString(path))
            .append("Kind", new BsonString(kind))
            .append("StepName", new BsonString(stepName))
            .append("Status", new BsonString(status))
            .append("Value", new BsonString(value))
            .append("Units", new BsonString(units))
            .append("Limits", limits.toDocument())
            .append("Timestamp", new BsonString(timestamp));
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
