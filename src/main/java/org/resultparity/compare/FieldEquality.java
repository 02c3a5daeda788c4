package org.resultparity.compare;

import java.math.BigDecimal;

/**
 * String-first, numeric-fallback equality used for every compared field.
 *
 * <p>Operands are trimmed and {@code null} counts as the empty string. Equal strings match, then
 * case-insensitively equal strings, then operands that both parse as the same decimal number
 * ({@code "1"} and {@code "1.00"}). Number parsing never depends on the default locale.
 */
public final class FieldEquality {
    private FieldEquality() {
    }

    public static boolean equal(String left, String right) {
        String leftText = left == null ? "" : left.trim();
        String rightText = right == null ? "" : right.trim();
        if (leftText.equals(rightText)) {
            return true;
        }
        if (leftText.equalsIgnoreCase(rightText)) {
            return true;
        }
        BigDecimal leftNumber = parseNumber(leftText);
        if (leftNumber == null) {
            return false;
        }
        BigDecimal rightNumber = parseNumber(rightText);
        return rightNumber != null && leftNumber.compareTo(rightNumber) == 0;
    }

    private static BigDecimal parseNumber(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
