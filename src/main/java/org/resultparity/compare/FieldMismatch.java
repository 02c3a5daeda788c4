package org.resultparity.compare;

import org.bson.BsonDocument;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonValue;

/**
 * One compared field whose reference and subject values differ.
 */
public record FieldMismatch(String field, String referenceValue, String subjectValue) {
    public FieldMismatch {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field must not be blank");
        }
    }

    public BsonDocument toDocument() {
        return new BsonDocument()
            .append("field", new BsonString(field))
            .append("reference", nullable(referenceValue))
            .append("subject", nullable(subjectValue));
    }

    private static BsonValue nullable(String value) {
        return value == null ? BsonNull.VALUE : new BsonString(value);
    }
}
