package org.resultparity.tree;

import java.util.Objects;
import org.resultparity.canonical.RecordKind;

/**
 * Leaf test step without a numeric result.
 */
public record StepNode(String name, String rawStatus, String rawTimestamp) implements SourceNode {
    public StepNode {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public RecordKind kind() {
        return RecordKind.STEP;
    }
}
