package org.resultparity.extract;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.resultparity.canonical.CanonicalRecord;
import org.resultparity.canonical.Limits;
import org.resultparity.canonical.RecordKind;
import org.resultparity.config.ParityConfig;

/**
 * Producer side of the annotation contract: renders canonical records as a bare HTML table,
 * one row per record, each row carrying the full annotation key set.
 *
 * <p>Rows also carry {@code data-id} / {@code data-parent} links and a {@code group} class so
 * that report front ends can rebuild the hierarchy. Neither is part of the contract.
 */
public final class ParityAnnotationWriter {
    private static final List<String> HEADERS = List.of(
        "Step", "Status", "Value", "Units", "Low", "High", "Expected", "Timestamp"
    );

    private final ParityConfig config;

    public ParityAnnotationWriter() {
        this(ParityConfig.defaults());
    }

    public ParityAnnotationWriter(ParityConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public String render(List<CanonicalRecord> records, String title) {
        Objects.requireNonNull(records, "records");
        String safeTitle = title == null || title.isBlank() ? "Test Results" : title.trim();

        Document document = Document.createShell("");
        document.title(safeTitle);
        document.body().appendElement("h1").text(safeTitle);
        Element table = document.body().appendElement("table");
        Element headerRow = table.appendElement("thead").appendElement("tr");
        for (String header : HEADERS) {
            headerRow.appendElement("th").text(header);
        }

        Element body = table.appendElement("tbody");
        Map<String, String> groupRowIds = new HashMap<>();
        for (int i = 0; i < records.size(); i++) {
            CanonicalRecord record = records.get(i);
            String rowId = "r" + i;
            Element row = body.appendElement("tr").attr("data-id", rowId);
            String parentRowId = groupRowIds.get(parentPath(record.path()));
            if (parentRowId != null) {
                row.attr("data-parent", parentRowId);
            }
            if (RecordKind.GROUP.label().equals(record.kind())) {
                row.addClass("group");
                groupRowIds.put(record.path(), rowId);
            }
            annotate(row, record);
            appendCells(row, record);
        }
        return document.outerHtml();
    }

    private void annotate(Element row, CanonicalRecord record) {
        Limits limits = record.limits();
        put(row, AnnotationKey.PATH, record.path());
        put(row, AnnotationKey.ORDINAL, Integer.toString(record.executionOrdinal()));
        put(row, AnnotationKey.KIND, record.kind());
        put(row, AnnotationKey.NAME, record.stepName());
        put(row, AnnotationKey.STATUS, record.status());
        put(row, AnnotationKey.VALUE, record.value());
        put(row, AnnotationKey.UNITS, record.units());
        put(row, AnnotationKey.LOW, limits.low());
        put(row, AnnotationKey.LOW_COMP, limits.lowComp());
        put(row, AnnotationKey.HIGH, limits.high());
        put(row, AnnotationKey.HIGH_COMP, limits.highComp());
        put(row, AnnotationKey.EXPECTED, limits.expected());
        put(row, AnnotationKey.EXPECTED_COMP, limits.expectedComp());
        put(row, AnnotationKey.TIMESTAMP, record.timestamp());
    }

    private void put(Element row, AnnotationKey key, String value) {
        row.attr(key.attribute(config.annotationPrefix()), value == null ? "" : value);
    }

    private static void appendCells(Element row, CanonicalRecord record) {
        Limits limits = record.limits();
        row.appendElement("td").addClass("name-cell").text(record.stepName());
        row.appendElement("td").text(record.status());
        row.appendElement("td").text(record.value());
        row.appendElement("td").text(record.units());
        row.appendElement("td").text(bound(limits.lowComp(), limits.low()));
        row.appendElement("td").text(bound(limits.highComp(), limits.high()));
        row.appendElement("td").text(bound(limits.expectedComp(), limits.expected()));
        row.appendElement("td").text(record.timestamp());
    }

    private static String bound(String comparator, String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return comparator + " " + value;
    }

    private static String parentPath(String path) {
        int separator = path.lastIndexOf('/');
        return separator < 0 ? "" : path.substring(0, separator);
    }
}
