package org.resultparity.canonical;

import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonValue;

/**
 * Normalized limits of one record. Value fields are {@code null} when absent; comparator
 * fields hold a {@link ComparisonOperator} name or an unrecognized token verbatim.
 */
public record Limits(
    String low,
    String lowComp,
    String high,
    String highComp,
    String expected,
    String expectedComp
) {
    private static final Limits NONE = new Limits(null, "NONE", null, "NONE", null, "NONE");

    public Limits {
        Objects.requireNonNull(lowComp, "lowComp");
        Objects.requireNonNull(highComp, "highComp");
        Objects.requireNonNull(expectedComp, "expectedComp");
    }

    public static Limits none() {
        return NONE;
    }

    public static Limits pair(String low, String lowComp, String high, String highComp) {
        return new Limits(low, lowComp, high, highComp, null, ComparisonOperator.NONE.name());
    }

    public static Limits expectedValue(String expected, String expectedComp) {
        String none = ComparisonOperator.NONE.name();
        return new Limits(null, none, null, none, expected, expectedComp);
    }

    public BsonDocument toDocument() {
        return new BsonDocument()
            .append("Low", nullable(low))
            .append("LowComp", new BsonString(lowComp))
            .append("High", nullable(high))
            .append("HighComp", new BsonString(highComp))
            .append("Expected", nullable(expected))
            .append("ExpectedComp", new BsonString(expectedComp));
    }

    private static BsonValue nullable(String value) {
        return value == null ? BsonNull.VALUE : new BsonString(value);
    }
}
