package org.resultparity.canonical;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.bson.BSONException;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.bson.json.JsonMode;
import org.bson.json.JsonParseException;
import org.bson.json.JsonWriterSettings;

/**
 * Reads and writes canonical record arrays as UTF-8 JSON, one record object per line.
 */
public final class CanonicalArrayCodec {
    private static final JsonWriterSettings WRITER_SETTINGS = JsonWriterSettings.builder()
        .outputMode(JsonMode.RELAXED)
        .build();

    private CanonicalArrayCodec() {
    }

    public static String toJson(List<CanonicalRecord> records) {
        Objects.requireNonNull(records, "records");
        if (records.isEmpty()) {
            return "[]\n";
        }
        StringBuilder sb = new StringBuilder("[\n");
        for (int i = 0; i < records.size(); i++) {
            sb.append("  ").append(records.get(i).toDocument().toJson(WRITER_SETTINGS));
            if (i < records.size() - 1) {
                sb.append(',');
            }
            sb.append('\n');
        }
        return sb.append("]\n").toString();
    }

    public static void write(List<CanonicalRecord> records, Path target) throws IOException {
        Objects.requireNonNull(target, "target");
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, toJson(records), StandardCharsets.UTF_8);
    }

    public static List<CanonicalRecord> read(Path source) throws IOException {
        Objects.requireNonNull(source, "source");
        Path normalized = source.toAbsolutePath().normalize();
        if (!Files.isRegularFile(normalized)) {
            throw new IllegalArgumentException("canonical array path does not exist: " + normalized);
        }
        return parse(Files.readString(normalized, StandardCharsets.UTF_8));
    }

    public static List<CanonicalRecord> parse(String json) {
        Objects.requireNonNull(json, "json");
        if (json.isBlank()) {
            throw new IllegalArgumentException("canonical array is empty");
        }
        BsonArray array;
        try {
            array = BsonArray.parse(json);
        } catch (JsonParseException | BSONException e) {
            throw new IllegalArgumentException("canonical array is not a JSON array: " + e.getMessage(), e);
        }
        List<CanonicalRecord> records = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            BsonValue item = array.get(i);
            if (!item.isDocument()) {
                throw new IllegalArgumentException("canonical array item " + i + " must be an object");
            }
            records.add(fromDocument(item.asDocument(), i));
        }
        return List.copyOf(records);
    }

    static CanonicalRecord fromDocument(BsonDocument document, int index) {
        String path = readText(document, "Path");
        int ordinal = readOrdinal(document.get("ExecutionOrdinal"), index);
        String key = readText(document, "CanonicalKey");
        if (key.isEmpty()) {
            key = CanonicalRecord.keyOf(path, ordinal);
        }
        BsonValue limitsValue = document.get("Limits");
        Limits limits = limitsValue != null && limitsValue.isDocument()
            ? limitsFromDocument(limitsValue.asDocument())
            : Limits.none();
        return new CanonicalRecord(
            key,
            ordinal,
            path,
            readText(document, "Kind"),
            readText(document, "StepName"),
            readText(document, "Status"),
            readText(document, "Value"),
            readText(document, "Units"),
            limits,
            readText(document, "Timestamp")
        );
    }

    private static Limits limitsFromDocument(BsonDocument document) {
        return new Limits(
            readNullableText(document, "Low"),
            readComparator(document, "LowComp"),
            readNullableText(document, "High"),
            readComparator(document, "HighComp"),
            readNullableText(document, "Expected"),
            readComparator(document, "ExpectedComp")
        );
    }

    private static int readOrdinal(BsonValue value, int index) {
        if (value != null && value.isInt32()) {
            return value.asInt32().getValue();
        }
        if (value != null && value.isNumber()) {
            try {
                return exactDecimal(value).intValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                throw new IllegalArgumentException(
                    "canonical array item " + index + " has a non-integral or out-of-range ExecutionOrdinal", e);
            }
        }
        if (value != null && value.isString()) {
            try {
                return Integer.parseInt(value.asString().getValue().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "canonical array item " + index + " has a non-numeric ExecutionOrdinal", e);
            }
        }
        throw new IllegalArgumentException("canonical array item " + index + " has no ExecutionOrdinal");
    }

    private static BigDecimal exactDecimal(BsonValue value) {
        if (value.isInt64()) {
            return BigDecimal.valueOf(value.asInt64().getValue());
        }
        if (value.isDouble()) {
            return BigDecimal.valueOf(value.asDouble().getValue());
        }
        return value.asDecimal128().decimal128Value().bigDecimalValue();
    }

    private static String readText(BsonDocument document, String key) {
        String value = readNullableText(document, key);
        return value == null ? "" : value;
    }

    private static String readComparator(BsonDocument document, String key) {
        String value = readNullableText(document, key);
        return value == null || value.isEmpty() ? ComparisonOperator.NONE.name() : value;
    }

    private static String readNullableText(BsonDocument document, String key) {
        BsonValue value = document.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isString()) {
            return value.asString().getValue();
        }
        if (value.isInt32()) {
            return Integer.toString(value.asInt32().getValue());
        }
        if (value.isInt64()) {
            return Long.toString(value.asInt64().getValue());
        }
        if (value.isDouble()) {
            return Double.toString(value.asDouble().getValue());
        }
        if (value.isBoolean()) {
            return Boolean.toString(value.asBoolean().getValue());
        }
        throw new IllegalArgumentException("field '" + key + "' must be a scalar");
    }
}
