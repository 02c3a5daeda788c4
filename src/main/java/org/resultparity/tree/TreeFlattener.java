package org.resultparity.tree;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.resultparity.canonical.ComparisonOperator;
import org.resultparity.canonical.LimitEntry;
import org.resultparity.canonical.RawLimits;
import org.w3c.dom.Element;

/**
 * Walks a test-results hierarchy depth-first, pre-order, in document order.
 *
 * <p>Only result sets, test groups, tests and session actions are visited; any other element,
 * along with its subtree, is skipped. Every consumer of the canonical contract depends on
 * this exact visiting order.
 *
 * <p>Because unrecognized subtrees are dropped whole, each emitted node sits at most one level
 * below its predecessor, and only directly under a group. Output of this class therefore never
 * makes {@link org.resultparity.canonical.PathOrdinalResolver} synthesize placeholder levels;
 * those only appear when a caller hands hand-built {@link FlatNode} lists to the resolver.
 */
public final class TreeFlattener {
    private static final Set<String> NUMERIC_TYPES = Set.of(
        "double", "float", "decimal", "integer", "int", "long", "short", "byte",
        "nonnegativeinteger", "positiveinteger", "unsignedint", "unsignedlong", "unsignedshort"
    );
    private static final Pattern SEQUENCE_SUFFIX = Pattern.compile("(?i)\\.seq$");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    public List<FlatNode> flatten(Element root) {
        Objects.requireNonNull(root, "root");
        List<FlatNode> flattened = new ArrayList<>();
        if (!SourceElements.isRecognized(root)) {
            return flattened;
        }

        Deque<PendingElement> stack = new ArrayDeque<>();
        stack.push(new PendingElement(root, 0));
        while (!stack.isEmpty()) {
            PendingElement pending = stack.pop();
            flattened.add(new FlatNode(pending.depth(), toSourceNode(pending.element(), pending.depth() == 0)));
            if (!SourceElements.CONTAINERS.contains(SourceElements.localName(pending.element()))) {
                continue;
            }
            List<Element> children = SourceElements.childElements(pending.element());
            for (int i = children.size() - 1; i >= 0; i--) {
                Element child = children.get(i);
                if (SourceElements.isRecognized(child)) {
                    stack.push(new PendingElement(child, pending.depth() + 1));
                }
            }
        }
        return flattened;
    }

    /**
     * Reformats a top-level result-set name: cut at {@code #}, keep the file-name segment, drop a
     * {@code .seq} suffix, then turn underscores into spaces and collapse whitespace.
     */
    public static String formatRootName(String rawName) {
        if (rawName == null) {
            return "";
        }
        String name = rawName;
        int hash = name.indexOf('#');
        if (hash >= 0) {
            name = name.substring(0, hash);
        }
        int separator = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (separator >= 0) {
            name = name.substring(separator + 1);
        }
        name = SEQUENCE_SUFFIX.matcher(name).replaceFirst("");
        name = WHITESPACE_RUN.matcher(name.replace('_', ' ')).replaceAll(" ").trim();
        return name.isEmpty() ? rawName.trim() : name;
    }

    private SourceNode toSourceNode(Element element, boolean isRoot) {
        String displayName = displayName(element);
        if (isRoot) {
            displayName = formatRootName(displayName);
        }
        String status = SourceElements.attribute(SourceElements.firstChild(element, "Outcome"), "value");
        String timestamp = SourceElements.attribute(element, "startDateTime");

        String localName = SourceElements.localName(element);
        if (SourceElements.CONTAINERS.contains(localName)) {
            return new GroupNode(displayName, status, timestamp);
        }
        Element testResult = SourceElements.firstChild(element, "TestResult");
        Element datum = SourceElements.descend(testResult, "TestData", "Datum");
        if (datum != null && isNumeric(datum)) {
            String units = SourceElements.attribute(datum, "nonStandardUnit");
            if (units == null || units.isEmpty()) {
                units = SourceElements.attribute(datum, "unit");
            }
            return new MeasurementNode(
                displayName,
                status,
                timestamp,
                SourceElements.attribute(datum, "value"),
                units,
                readLimits(testResult)
            );
        }
        return new StepNode(displayName, status, timestamp);
    }

    private static String displayName(Element element) {
        for (String attribute : List.of("callerName", "name", "ID")) {
            String value = SourceElements.attribute(element, attribute);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return SourceElements.localName(element);
    }

    private static boolean isNumeric(Element datum) {
        String type = SourceElements.xsiType(datum);
        if (type != null && NUMERIC_TYPES.contains(type.toLowerCase(Locale.ROOT))) {
            return true;
        }
        String value = SourceElements.attribute(datum, "value");
        if (value == null || value.isBlank()) {
            return false;
        }
        try {
            new BigDecimal(value.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static RawLimits readLimits(Element testResult) {
        Element limits = SourceElements.descend(testResult, "TestLimits", "Limits");
        if (limits == null) {
            return RawLimits.absent();
        }
        List<LimitEntry> candidates = new ArrayList<>();
        LimitEntry expected = null;
        for (Element child : SourceElements.childElements(limits)) {
            switch (SourceElements.localName(child)) {
                case "LimitPair" -> {
                    for (Element limit : SourceElements.childElements(child)) {
                        if ("Limit".equals(SourceElements.localName(limit))) {
                            candidates.add(limitEntry(limit));
                        }
                    }
                }
                case "SingleLimit" -> {
                    LimitEntry single = limitEntry(child);
                    if (isBound(single)) {
                        candidates.add(single);
                    } else if (expected == null) {
                        expected = single;
                    }
                }
                case "Expected" -> {
                    if (expected == null) {
                        expected = limitEntry(child);
                    }
                }
                default -> {
                    // limit expressions and extensions carry no canonical limits
                }
            }
        }
        return new RawLimits(candidates, expected);
    }

    private static boolean isBound(LimitEntry entry) {
        return ComparisonOperator.parse(entry.comparator())
            .map(operator -> operator.isGreaterFamily() || operator.isLesserFamily())
            .orElse(false);
    }

    private static LimitEntry limitEntry(Element limit) {
        Element datum = SourceElements.firstChild(limit, "Datum");
        return new LimitEntry(
            SourceElements.attribute(limit, "comparator"),
            SourceElements.attribute(datum, "value")
        );
    }

    private record PendingElement(Element element, int depth) {
    }
}
