package org.resultparity.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.resultparity.CapturedLog;
import org.resultparity.canonical.CanonicalRecord;
import org.resultparity.config.DuplicateKeyPolicy;
import org.resultparity.config.ParityConfig;
import org.resultparity.obs.RunContext;

class EmbeddedCanonicalExtractorTest {
    private final EmbeddedCanonicalExtractor extractor = new EmbeddedCanonicalExtractor();

    @Test
    void readsAnnotationsRegardlessOfSurroundingMarkup() {
        String table = "<table><tbody>"
            + "<tr data-parity-path=\"Root\" data-parity-ordinal=\"1\" data-parity-kind=\"Group\""
            + " data-parity-name=\"Root\" data-parity-status=\"Passed\"><td>Root</td></tr>"
            + "<tr data-parity-path=\"Root/V\" data-parity-ordinal=\"1\" data-parity-kind=\"Measurement\""
            + " data-parity-name=\"V\" data-parity-value=\"5\" data-parity-units=\"V\""
            + " data-parity-low=\"4.5\" data-parity-lowcomp=\"GE\"><td>shown text is ignored</td></tr>"
            + "</tbody></table>";
        String cards = "<section><div class=\"card\" data-parity-path=\"Root\" data-parity-ordinal=\"1\""
            + " data-parity-kind=\"Group\" data-parity-name=\"Root\" data-parity-status=\"Passed\">"
            + "<ul><li><span data-parity-path=\"Root/V\" data-parity-ordinal=\"1\""
            + " data-parity-kind=\"Measurement\" data-parity-name=\"V\" data-parity-value=\"5\""
            + " data-parity-units=\"V\" data-parity-low=\"4.5\" data-parity-lowcomp=\"&gt;=\">"
            + "something else</span></li></ul></div></section>";

        List<CanonicalRecord> fromTable = extractor.extractContent(table).records();
        List<CanonicalRecord> fromCards = extractor.extractContent(cards).records();

        assertEquals(2, fromTable.size());
        assertEquals(fromTable, fromCards);
        assertEquals("Root/V|1", fromCards.get(1).canonicalKey());
        assertEquals("GE", fromCards.get(1).limits().lowComp());
    }

    @Test
    void decodesEntitiesInAttributeValues() {
        String html = "<p data-parity-path=\"Root/Temp &amp; Humidity\" data-parity-ordinal=\"2\""
            + " data-parity-name=\"Temp &amp; Humidity\" data-parity-expected=\"&lt;none&gt;\"></p>";

        CanonicalRecord record = extractor.extractContent(html).records().get(0);

        assertEquals("Root/Temp & Humidity|2", record.canonicalKey());
        assertEquals("Temp & Humidity", record.stepName());
        assertEquals("<none>", record.limits().expected());
    }

    @Test
    void appliesDefaultsForAbsentAnnotations() {
        CanonicalRecord record = extractor
            .extractContent("<div data-parity-path=\"Root\" data-parity-ordinal=\" 3 \"></div>")
            .records()
            .get(0);

        assertEquals(3, record.executionOrdinal());
        assertEquals("Unknown", record.kind());
        assertEquals("", record.status());
        assertEquals("", record.value());
        assertEquals("", record.timestamp());
        assertEquals("", record.limits().low());
        assertEquals("NONE", record.limits().lowComp());
        assertEquals("NONE", record.limits().expectedComp());
    }

    @Test
    void skipsFragmentsWithoutIdentityAndWarns() {
        CapturedLog log = new CapturedLog();
        EmbeddedCanonicalExtractor logged = new EmbeddedCanonicalExtractor(
            ParityConfig.defaults(),
            log.logger(),
            RunContext.of("run-1", "extract-embedded")
        );
        String html = "<div data-parity-status=\"Passed\"></div>"
            + "<div data-parity-path=\"Root\" data-parity-ordinal=\"1\"></div>"
            + "<div data-parity-path=\"Root/A\"></div>"
            + "<div data-parity-path=\"Root/B\" data-parity-ordinal=\"0\"></div>";

        EmbeddedCanonicalExtractor.EmbeddedExtraction extraction = logged.extractContent(html);

        assertEquals(1, extraction.records().size());
        assertEquals(3, extraction.skipped().size());
        assertEquals(0, extraction.skipped().get(0).fragmentIndex());
        assertEquals("missing path and ordinal annotations", extraction.skipped().get(0).reason());
        assertEquals("missing ordinal annotation", extraction.skipped().get(1).reason());
        assertEquals("ordinal is not a positive integer", extraction.skipped().get(2).reason());

        List<Document> warnings = log.events("WARN");
        assertEquals(3, warnings.size());
        assertEquals("AnnotationMissing: fragment skipped", warnings.get(0).getString("message"));
        assertEquals("div", warnings.get(0).getString("element"));
        assertEquals(2, warnings.get(1).getInteger("fragmentIndex"));
        assertEquals("AnnotationMissing: fragment skipped", warnings.get(1).getString("message"));
        assertEquals("AnnotationInvalid: fragment skipped", warnings.get(2).getString("message"));
        assertEquals(3, warnings.get(2).getInteger("fragmentIndex"));
    }

    @Test
    void reportsNonNumericOrdinalAsInvalidAnnotation() {
        CapturedLog log = new CapturedLog();
        EmbeddedCanonicalExtractor logged = new EmbeddedCanonicalExtractor(
            ParityConfig.defaults(),
            log.logger(),
            RunContext.of("run-1", "extract-embedded")
        );
        String html = "<div data-parity-path=\"Root\" data-parity-ordinal=\"1\"></div>"
            + "<span data-parity-path=\"Root/A\" data-parity-ordinal=\"first\"></span>";

        EmbeddedCanonicalExtractor.EmbeddedExtraction extraction = logged.extractContent(html);

        assertEquals(1, extraction.skipped().size());
        assertEquals("ordinal is not a positive integer", extraction.skipped().get(0).reason());
        List<Document> warnings = log.events("WARN");
        assertEquals(1, warnings.size());
        assertEquals("AnnotationInvalid: fragment skipped", warnings.get(0).getString("message"));
        assertEquals("span", warnings.get(0).getString("element"));
    }

    @Test
    void honoursConfiguredAnnotationPrefix() {
        ParityConfig config = new ParityConfig(
            "Unknown", "data-rp-", DuplicateKeyPolicy.REJECT, ParityConfig.DEFAULT_TIMESTAMP_PATTERN
        );
        EmbeddedCanonicalExtractor custom = new EmbeddedCanonicalExtractor(
            config,
            new CapturedLog().logger(),
            RunContext.of("run-1", "extract-embedded")
        );
        String html = "<div data-parity-path=\"Ignored\" data-parity-ordinal=\"1\"></div>"
            + "<div data-rp-path=\"Root\" data-rp-ordinal=\"1\" data-rp-kind=\"Group\"></div>";

        List<CanonicalRecord> records = custom.extractContent(html).records();

        assertEquals(1, records.size());
        assertEquals("Root|1", records.get(0).canonicalKey());
    }

    @Test
    void failsWhenArtifactHasNoUsableAnnotations() {
        ExtractionException none = assertThrows(
            ExtractionException.class,
            () -> extractor.extractContent("<html><body><table><tr><td>x</td></tr></table></body></html>")
        );
        assertEquals(ExtractionFailure.STRUCTURAL_EMPTY, none.failure());

        ExtractionException allSkipped = assertThrows(
            ExtractionException.class,
            () -> extractor.extractContent("<div data-parity-name=\"orphan\"></div>")
        );
        assertEquals(ExtractionFailure.STRUCTURAL_EMPTY, allSkipped.failure());
        assertTrue(allSkipped.getMessage().startsWith("StructuralEmpty: "));

        assertEquals(
            ExtractionFailure.EMPTY_INPUT,
            assertThrows(ExtractionException.class, () -> extractor.extractContent("   ")).failure()
        );
    }
}
