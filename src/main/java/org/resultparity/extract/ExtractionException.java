package org.resultparity.extract;

import java.util.Objects;

/**
 * Raised when an input cannot produce a canonical array at all.
 */
public final class ExtractionException extends RuntimeException {
    private final ExtractionFailure failure;

    public ExtractionException(ExtractionFailure failure, String message) {
        super(message);
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public ExtractionException(ExtractionFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public ExtractionFailure failure() {
        return failure;
    }

    @Override
    public String getMessage() {
        return failure.code() + ": " + super.getMessage();
    }
}
