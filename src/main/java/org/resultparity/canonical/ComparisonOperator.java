package org.resultparity.canonical;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical limit comparators.
 */
public enum ComparisonOperator {
    GE,
    GT,
    LE,
    LT,
    EQ,
    NE,
    NONE;

    private static final Map<String, ComparisonOperator> ALIASES = new HashMap<>();

    static {
        alias(GE, "ge", "gte", "greaterorequal", "greaterthanorequal", "greaterthanorequalto", ">=", "=>", "\u2265");
        alias(GT, "gt", "greater", "greaterthan", ">");
        alias(LE, "le", "lte", "lessorequal", "lessthanorequal", "lessthanorequalto", "<=", "=<", "\u2264");
        alias(LT, "lt", "less", "lessthan", "<");
        alias(EQ, "eq", "equal", "equals", "equalto", "=", "==");
        alias(NE, "ne", "notequal", "notequals", "notequalto", "!=", "<>", "\u2260");
        alias(NONE, "none");
    }

    /**
     * Looks up a comparator token in its textual ({@code gte}, {@code Greater Or Equal}),
     * symbolic ({@code >=}, {@code \u2265}) or entity ({@code &gt;=}, {@code &ge;}) form, ignoring case.
     */
    public static Optional<ComparisonOperator> parse(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String decoded = decodeEntities(token.trim().toLowerCase(Locale.ROOT));
        ComparisonOperator direct = ALIASES.get(decoded);
        if (direct != null) {
            return Optional.of(direct);
        }
        String compact = decoded.replace(" ", "").replace("_", "").replace("-", "");
        return Optional.ofNullable(ALIASES.get(compact));
    }

    public boolean isGreaterFamily() {
        return this == GE || this == GT;
    }

    public boolean isLesserFamily() {
        return this == LE || this == LT;
    }

    private static String decodeEntities(String token) {
        return token
            .replace("&gt;", ">")
            .replace("&lt;", "<")
            .replace("&#62;", ">")
            .replace("&#60;", "<")
            .replace("&#x3e;", ">")
            .replace("&#x3c;", "<")
            .replace("&ge;", ">=")
            .replace("&le;", "<=")
            .replace("&ne;", "!=")
            .replace("&#8805;", ">=")
            .replace("&#8804;", "<=")
            .replace("&#8800;", "!=")
            .replace("&#x2265;", ">=")
            .replace("&#x2264;", "<=")
            .replace("&#x2260;", "!=")
            .replace("&equals;", "=");
    }

    private static void alias(ComparisonOperator operator, String... tokens) {
        for (String token : tokens) {
            ALIASES.put(token, operator);
        }
    }
}
