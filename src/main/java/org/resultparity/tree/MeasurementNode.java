package org.resultparity.tree;

import java.util.Objects;
import org.resultparity.canonical.RawLimits;
import org.resultparity.canonical.RecordKind;

/**
 * Leaf test step carrying one numeric result and its limits.
 */
public record MeasurementNode(
    String name,
    String rawStatus,
    String rawTimestamp,
    String rawValue,
    String rawUnits,
    RawLimits rawLimits
) implements SourceNode {
    public MeasurementNode {
        Objects.requireNonNull(name, "name");
        rawLimits = rawLimits == null ? RawLimits.absent() : rawLimits;
    }

    @Override
    public RecordKind kind() {
        return RecordKind.MEASUREMENT;
    }
}
