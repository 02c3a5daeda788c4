package org.resultparity.extract;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.resultparity.canonical.CanonicalKeys;
import org.resultparity.canonical.CanonicalRecord;
import org.resultparity.canonical.Limits;
import org.resultparity.canonical.PathOrdinalResolver;
import org.resultparity.canonical.RecordNormalizer;
import org.resultparity.config.ParityConfig;
import org.resultparity.obs.JsonLinesLogger;
import org.resultparity.obs.RunContext;
import org.resultparity.tree.FlatNode;
import org.resultparity.tree.MeasurementNode;
import org.resultparity.tree.SourceDocumentReader;
import org.resultparity.tree.SourceNode;
import org.resultparity.tree.SourceShapeException;
import org.resultparity.tree.TreeFlattener;
import org.w3c.dom.Element;

/**
 * Derives the reference canonical array directly from a test-results document.
 */
public final class SourceCanonicalExtractor {
    private final ParityConfig config;
    private final JsonLinesLogger logger;
    private final RunContext runContext;
    private final TreeFlattener flattener = new TreeFlattener();

    public SourceCanonicalExtractor() {
        this(ParityConfig.defaults(), JsonLinesLogger.noop(), RunContext.of("local", "extract-source"));
    }

    public SourceCanonicalExtractor(ParityConfig config, JsonLinesLogger logger, RunContext runContext) {
        this.config = Objects.requireNonNull(config, "config");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.runContext = Objects.requireNonNull(runContext, "runContext");
    }

    public List<CanonicalRecord> extract(Path source) throws IOException {
        return extractContent(InputFiles.readRequired(source, "source document"));
    }

    public List<CanonicalRecord> extractContent(String content) {
        InputFiles.requireContent(content, "source document");
        Optional<Element> root;
        try {
            root = SourceDocumentReader.readRoot(content);
        } catch (SourceShapeException e) {
            throw new ExtractionException(ExtractionFailure.MALFORMED_INPUT, e.getMessage(), e);
        }
        if (root.isEmpty()) {
            throw new ExtractionException(ExtractionFailure.STRUCTURAL_EMPTY, "source document has no result set");
        }

        List<FlatNode> nodes = flattener.flatten(root.get());
        if (nodes.isEmpty()) {
            throw new ExtractionException(ExtractionFailure.STRUCTURAL_EMPTY, "source traversal yielded no nodes");
        }

        List<CanonicalRecord> records = toRecords(nodes);
        List<String> duplicates = CanonicalKeys.duplicates(records);
        if (!duplicates.isEmpty()) {
            logger.warn(
                "source produced duplicate canonical keys",
                runContext,
                Map.of("duplicateKeys", duplicates)
            );
        }
        logger.info("source extraction completed", runContext, Map.of("records", records.size()));
        return records;
    }

    /**
     * Resolves and normalizes already-flattened nodes, in the given order. Depth gaps in the
     * supplied list are filled with placeholder levels.
     */
    public List<CanonicalRecord> toRecords(List<FlatNode> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        RecordNormalizer normalizer = new RecordNormalizer(config.timestampPattern(), logger, runContext);
        PathOrdinalResolver resolver = new PathOrdinalResolver(config.placeholderSegment());
        List<CanonicalRecord> records = new ArrayList<>(nodes.size());
        for (FlatNode flatNode : nodes) {
            SourceNode node = flatNode.node();
            PathOrdinalResolver.ResolvedIdentity identity = resolver.resolve(flatNode.depth(), node.name(), node.kind());

            String value = "";
            String units = "";
            Limits limits = Limits.none();
            if (node instanceof MeasurementNode measurement) {
                value = normalizer.text(measurement.rawValue());
                units = normalizer.text(measurement.rawUnits());
                limits = normalizer.limits(measurement.rawLimits());
            }
            records.add(new CanonicalRecord(
                identity.canonicalKey(),
                identity.executionOrdinal(),
                identity.path(),
                node.kind().label(),
                node.name(),
                normalizer.text(node.rawStatus()),
                value,
                units,
                limits,
                normalizer.timestamp(node.rawTimestamp())
            ));
        }
        if (resolver.placeholderCount() > 0) {
            logger.warn(
                "synthesized placeholder path segments for skipped depths",
                runContext,
                Map.of("placeholders", resolver.placeholderCount())
            );
        }
        return List.copyOf(records);
    }
}
