package org.resultparity.tree;

/**
 * Source content that is not a well-formed test-results document.
 */
public final class SourceShapeException extends IllegalArgumentException {
    public SourceShapeException(String message) {
        super(message);
    }

    public SourceShapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
