package org.resultparity.tree;

import java.util.Objects;

/**
 * A source node and its depth in the hierarchy; the root is at depth 0.
 */
public record FlatNode(int depth, SourceNode node) {
    public FlatNode {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative: " + depth);
        }
        Objects.requireNonNull(node, "node");
    }
}
