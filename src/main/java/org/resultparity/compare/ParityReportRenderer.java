package org.resultparity.compare;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;
import org.resultparity.canonical.CanonicalRecord;

/**
 * Renders parity reports in markdown and JSON.
 */
public final class ParityReportRenderer {
    private static final JsonWriterSettings JSON_SETTINGS = JsonWriterSettings.builder()
        .outputMode(JsonMode.RELAXED)
        .indent(true)
        .build();

    public String toMarkdown(ParityReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Parity Report\n\n");
        sb.append("- generatedAt: ").append(report.generatedAt()).append('\n');
        sb.append("- compared: ").append(report.referenceLabel()).append(" vs ").append(report.subjectLabel()).append('\n');
        sb.append("- verdict: ").append(report.passed() ? "PASS" : "FAIL").append('\n');
        sb.append("- reference records: ").append(report.referenceCount()).append('\n');
        sb.append("- subject records: ").append(report.subjectCount()).append('\n');
        sb.append("- matched: ").append(report.matchedCount()).append('\n');
        sb.append("- dropped: ").append(report.dropped().size()).append('\n');
        sb.append("- hallucinated: ").append(report.hallucinated().size()).append('\n');
        sb.append("- corrupted: ").append(report.corrupted().size()).append("\n\n");

        appendRecords(sb, "Dropped", report.dropped());
        appendRecords(sb, "Hallucinated", report.hallucinated());
        if (!report.corrupted().isEmpty()) {
            sb.append("## Corrupted\n");
            for (CorruptedRecord record : report.corrupted()) {
                sb.append("- `").append(record.canonicalKey()).append("`\n");
                for (FieldMismatch mismatch : record.mismatches()) {
                    sb.append("  - ").append(mismatch.field()).append(": ")
                        .append(quote(mismatch.referenceValue()))
                        .append(" <> ")
                        .append(quote(mismatch.subjectValue()))
                        .append('\n');
                }
            }
            sb.append('\n');
        }
        if (report.hasDuplicateKeys()) {
            sb.append("## Duplicate keys (").append(report.duplicateKeyPolicy().value()).append(")\n");
            for (String key : report.referenceDuplicateKeys()) {
                sb.append("- reference: `").append(key).append("`\n");
            }
            for (String key : report.subjectDuplicateKeys()) {
                sb.append("- subject: `").append(key).append("`\n");
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public String toJson(ParityReport report) {
        return report.toDocument().toJson(JSON_SETTINGS);
    }

    /**
     * Writes markdown when the target ends in {@code .md}, JSON otherwise.
     */
    public void write(ParityReport report, Path target) throws IOException {
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(target, "target");
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String fileName = target.getFileName().toString().toLowerCase(Locale.ROOT);
        String content = fileName.endsWith(".md") ? toMarkdown(report) : toJson(report) + "\n";
        Files.writeString(target, content, StandardCharsets.UTF_8);
    }

    private static void appendRecords(StringBuilder sb, String title, List<CanonicalRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        sb.append("## ").append(title).append('\n');
        for (CanonicalRecord record : records) {
            sb.append("- `").append(record.canonicalKey()).append("` ")
                .append(record.kind());
            if (!record.status().isEmpty()) {
                sb.append(" (").append(record.status()).append(')');
            }
            sb.append('\n');
        }
        sb.append('\n');
    }

    private static String quote(String value) {
        return value == null ? "null" : "\"" + value + "\"";
    }
}
