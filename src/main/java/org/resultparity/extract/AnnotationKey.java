package org.resultparity.extract;

/**
 * Keys of the embedded annotation contract. Each canonical field travels as one attribute
 * named {@code <prefix><key>}, e.g. {@code data-parity-path}.
 */
public enum AnnotationKey {
    PATH("path"),
    ORDINAL("ordinal"),
    KIND("kind"),
    NAME("name"),
    STATUS("status"),
    VALUE("value"),
    UNITS("units"),
    LOW("low"),
    LOW_COMP("lowcomp"),
    HIGH("high"),
    HIGH_COMP("highcomp"),
    EXPECTED("expected"),
    EXPECTED_COMP("expectedcomp"),
    TIMESTAMP("timestamp");

    private final String key;

    AnnotationKey(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public String attribute(String prefix) {
        return prefix + key;
    }
}
