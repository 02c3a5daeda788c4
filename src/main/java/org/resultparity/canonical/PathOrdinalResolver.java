package org.resultparity.canonical;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Assigns hierarchical paths and execution ordinals to nodes visited in pre-order.
 *
 * <p>The resolver keeps two stacks indexed by depth: one opaque scope marker per open group level
 * and the matching display names. A node at depth {@code L} sees exactly {@code L} ancestor
 * segments. When traversal jumps deeper than the open scope, the missing levels are filled with
 * the placeholder segment. This is a heuristic: nothing checks that a skipped level really was a
 * benign wrapper in the source schema. Traversals that skip unrecognized subtrees whole never
 * jump more than one level, so gaps come only from callers supplying node lists directly.
 *
 * <p>Ordinal counters are keyed by {@code (ParentPath, Name, Kind)} and live as long as the
 * resolver; use one instance per extraction run.
 */
public final class PathOrdinalResolver {
    private static final String PATH_SEPARATOR = "/";

    private final String placeholderSegment;
    private final List<String> scopeStack = new ArrayList<>();
    private final List<String> segmentStack = new ArrayList<>();
    private final Map<String, Integer> ordinalCounters = new HashMap<>();
    private int placeholderCount;

    public PathOrdinalResolver(String placeholderSegment) {
        this.placeholderSegment = requireText(placeholderSegment, "placeholderSegment");
    }

    /**
     * Resolves the identity of the next node in traversal order. Group nodes open a new scope
     * for the nodes that follow; other kinds leave the stacks untouched.
     */
    public ResolvedIdentity resolve(int depth, String name, RecordKind kind) {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative: " + depth);
        }
        Objects.requireNonNull(kind, "kind");
        String safeName = name == null ? "" : name;

        alignToDepth(depth);
        String parentPath = String.join(PATH_SEPARATOR, segmentStack);
        String currentPath = parentPath.isEmpty() ? safeName : parentPath + PATH_SEPARATOR + safeName;

        String ordinalKey = parentPath + CanonicalRecord.KEY_SEPARATOR + safeName
            + CanonicalRecord.KEY_SEPARATOR + kind.label();
        int ordinal = ordinalCounters.merge(ordinalKey, 1, Integer::sum);
        String canonicalKey = CanonicalRecord.keyOf(currentPath, ordinal);

        if (kind == RecordKind.GROUP) {
            scopeStack.add(canonicalKey);
            segmentStack.add(safeName);
        }
        return new ResolvedIdentity(parentPath, currentPath, ordinal, canonicalKey);
    }

    /**
     * Number of placeholder levels synthesized so far.
     */
    public int placeholderCount() {
        return placeholderCount;
    }

    int openScopeDepth() {
        return scopeStack.size();
    }

    // Ascending invalidates deeper scope, including a previous sibling group at this depth.
    // Descending past the open scope pads every missing level.
    private void alignToDepth(int depth) {
        while (scopeStack.size() > depth) {
            scopeStack.remove(scopeStack.size() - 1);
        }
        while (segmentStack.size() > depth) {
            segmentStack.remove(segmentStack.size() - 1);
        }
        while (scopeStack.size() < depth) {
            scopeStack.add("placeholder@" + scopeStack.size());
            segmentStack.add(placeholderSegment);
            placeholderCount++;
        }
    }

    private static String requireText(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }

    /**
     * Path identity of one visited node.
     */
    public record ResolvedIdentity(String parentPath, String path, int executionOrdinal, String canonicalKey) {
    }
}
