package org.resultparity.tree;

import java.util.Objects;
import org.resultparity.canonical.RecordKind;

/**
 * Container node: the result set itself or a test group.
 */
public record GroupNode(String name, String rawStatus, String rawTimestamp) implements SourceNode {
    public GroupNode {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public RecordKind kind() {
        return RecordKind.GROUP;
    }
}
