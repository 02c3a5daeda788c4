package org.resultparity.extract;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.resultparity.canonical.CanonicalRecord;
import org.resultparity.canonical.Limits;
import org.resultparity.canonical.RecordKind;
import org.resultparity.canonical.RecordNormalizer;
import org.resultparity.config.ParityConfig;
import org.resultparity.obs.JsonLinesLogger;
import org.resultparity.obs.RunContext;

/**
 * Re-derives a canonical array from the annotations embedded in a rendered artifact.
 *
 * <p>Only the annotation attributes are read; the surrounding markup, its nesting and its
 * visible text are irrelevant. A fragment is any element carrying at least one attribute with
 * the annotation prefix.
 */
public final class EmbeddedCanonicalExtractor {
    private final ParityConfig config;
    private final JsonLinesLogger logger;
    private final RunContext runContext;

    public EmbeddedCanonicalExtractor() {
        this(ParityConfig.defaults(), JsonLinesLogger.noop(), RunContext.of("local", "extract-embedded"));
    }

    public EmbeddedCanonicalExtractor(ParityConfig config, JsonLinesLogger logger, RunContext runContext) {
        this.config = Objects.requireNonNull(config, "config");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.runContext = Objects.requireNonNull(runContext, "runContext");
    }

    public EmbeddedExtraction extract(Path artifact) throws IOException {
        return extractContent(InputFiles.readRequired(artifact, "artifact"));
    }

    public EmbeddedExtraction extractContent(String content) {
        InputFiles.requireContent(content, "artifact");
        Document document = Jsoup.parse(content);
        Elements fragments = document.select("[^" + config.annotationPrefix() + "]");
        if (fragments.isEmpty()) {
            throw new ExtractionException(
                ExtractionFailure.STRUCTURAL_EMPTY,
                "artifact carries no " + config.annotationPrefix() + "* annotations"
            );
        }

        RecordNormalizer normalizer = new RecordNormalizer(config.timestampPattern(), logger, runContext);
        List<CanonicalRecord> records = new ArrayList<>(fragments.size());
        List<SkippedFragment> skipped = new ArrayList<>();
        for (int i = 0; i < fragments.size(); i++) {
            Element fragment = fragments.get(i);
            String missing = missingIdentity(fragment);
            if (missing != null) {
                skip(skipped, i, fragment, "AnnotationMissing", missing);
                continue;
            }
            int ordinal = parseOrdinal(read(fragment, AnnotationKey.ORDINAL));
            if (ordinal < 1) {
                skip(skipped, i, fragment, "AnnotationInvalid", "ordinal is not a positive integer");
                continue;
            }
            records.add(toRecord(fragment, ordinal, normalizer));
        }

        if (records.isEmpty()) {
            throw new ExtractionException(
                ExtractionFailure.STRUCTURAL_EMPTY,
                "artifact has no fragment with both path and ordinal annotations"
            );
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("records", records.size());
        fields.put("skippedFragments", skipped.size());
        logger.info("embedded extraction completed", runContext, fields);
        return new EmbeddedExtraction(records, skipped);
    }

    private CanonicalRecord toRecord(Element fragment, int ordinal, RecordNormalizer normalizer) {
        String path = read(fragment, AnnotationKey.PATH);
        String kind = read(fragment, AnnotationKey.KIND);
        Limits limits = new Limits(
            normalizer.text(read(fragment, AnnotationKey.LOW)),
            normalizer.comparator(read(fragment, AnnotationKey.LOW_COMP)),
            normalizer.text(read(fragment, AnnotationKey.HIGH)),
            normalizer.comparator(read(fragment, AnnotationKey.HIGH_COMP)),
            normalizer.text(read(fragment, AnnotationKey.EXPECTED)),
            normalizer.comparator(read(fragment, AnnotationKey.EXPECTED_COMP))
        );
        return CanonicalRecord.of(
            path,
            ordinal,
            kind == null ? RecordKind.UNKNOWN_LABEL : kind,
            normalizer.text(read(fragment, AnnotationKey.NAME)),
            normalizer.text(read(fragment, AnnotationKey.STATUS)),
            normalizer.text(read(fragment, AnnotationKey.VALUE)),
            normalizer.text(read(fragment, AnnotationKey.UNITS)),
            limits,
            normalizer.timestamp(read(fragment, AnnotationKey.TIMESTAMP))
        );
    }

    private String missingIdentity(Element fragment) {
        boolean hasPath = fragment.hasAttr(AnnotationKey.PATH.attribute(config.annotationPrefix()));
        boolean hasOrdinal = fragment.hasAttr(AnnotationKey.ORDINAL.attribute(config.annotationPrefix()));
        if (hasPath && hasOrdinal) {
            return null;
        }
        if (!hasPath && !hasOrdinal) {
            return "missing path and ordinal annotations";
        }
        return hasPath ? "missing ordinal annotation" : "missing path annotation";
    }

    private void skip(List<SkippedFragment> skipped, int index, Element fragment, String code, String reason) {
        SkippedFragment entry = new SkippedFragment(index, fragment.tagName(), reason);
        skipped.add(entry);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("fragmentIndex", index);
        fields.put("element", fragment.tagName());
        fields.put("reason", reason);
        logger.warn(code + ": fragment skipped", runContext, fields);
    }

    /**
     * Entity-decoded attribute value, or {@code null} when the annotation is absent.
     */
    private String read(Element fragment, AnnotationKey key) {
        String attribute = key.attribute(config.annotationPrefix());
        return fragment.hasAttr(attribute) ? fragment.attr(attribute) : null;
    }

    private static int parseOrdinal(String raw) {
        if (raw == null) {
            return -1;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /**
     * Records recovered from an artifact plus the fragments that had to be skipped.
     */
    public record EmbeddedExtraction(List<CanonicalRecord> records, List<SkippedFragment> skipped) {
        public EmbeddedExtraction {
            records = List.copyOf(Objects.requireNonNull(records, "records"));
            skipped = List.copyOf(Objects.requireNonNull(skipped, "skipped"));
        }
    }

    /**
     * One fragment without a usable identity.
     */
    public record SkippedFragment(int fragmentIndex, String element, String reason) {
    }
}
