package org.resultparity.tree;

import org.resultparity.canonical.RecordKind;

/**
 * One recognized node of the source hierarchy, with its raw fields still unnormalized.
 * Implemented by {@link GroupNode}, {@link StepNode} and {@link MeasurementNode}.
 */
public interface SourceNode {
    String name();

    String rawStatus();

    String rawTimestamp();

    RecordKind kind();
}
