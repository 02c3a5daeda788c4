package org.resultparity.extract;

/**
 * Fatal extraction outcomes and the process exit code each maps to.
 */
public enum ExtractionFailure {
    INPUT_NOT_FOUND("InputNotFound", 1),
    EMPTY_INPUT("EmptyInput", 1),
    MALFORMED_INPUT("MalformedInput", 1),
    STRUCTURAL_EMPTY("StructuralEmpty", 2);

    private final String code;
    private final int exitCode;

    ExtractionFailure(String code, int exitCode) {
        this.code = code;
        this.exitCode = exitCode;
    }

    public String code() {
        return code;
    }

    public int exitCode() {
        return exitCode;
    }
}
