package io.github.cyfko.fuzzycast.core.api;

/**
 * Comparison operators a {@link io.github.cyfko.fuzzycast.core.model.FieldCondition} can apply.
 * <p>
 * Each operator carries a SQL-like symbol (used for rendering) and a stable code. Fuzzy
 * composition itself only produces {@link #EQ} and {@link #IMATCHES}; {@link #NE} and
 * {@link #MATCHES} exist so callers can express the conditions of a base expression with the
 * same model.
 * </p>
 *
 * @since 1.0.0
 */
public enum Op {

    /** Equality operator: "=" */
    EQ("=", "EQ"),

    /** Not equal operator: "!=" */
    NE("!=", "NE"),

    /** Case-sensitive pattern matching operator: "LIKE" */
    MATCHES("LIKE", "MATCHES"),

    /** Case-insensitive pattern matching operator: "ILIKE" */
    IMATCHES("ILIKE", "IMATCHES");

    private final String symbol;
    private final String code;

    Op(String symbol, String code) {
        this.symbol = symbol;
        this.code = code;
    }

    /**
     * Returns the SQL-like symbol of this operator.
     *
     * @return the operator symbol, e.g. {@code "ILIKE"}
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Returns the code of this operator.
     *
     * @return the operator code, e.g. {@code "IMATCHES"}
     */
    public String getCode() {
        return code;
    }

    /**
     * Whether this operator compares against a LIKE pattern rather than a plain value.
     *
     * @return {@code true} for {@link #MATCHES} and {@link #IMATCHES}
     */
    public boolean isPattern() {
        return this == MATCHES || this == IMATCHES;
    }

    /**
     * Resolves an operator from its symbol or code (case-insensitive, surrounding blanks ignored).
     *
     * @param value the symbol or the code
     * @return the matching operator
     * @throws IllegalArgumentException if no operator matches
     */
    public static Op fromString(String value) {
        String trimmed = value.trim();

        for (Op op : values()) {
            if (op.symbol.equalsIgnoreCase(trimmed)) return op;
            if (op.code.equalsIgnoreCase(trimmed)) return op;
        }

        throw new IllegalArgumentException("Unknown operator: " + value);
    }
}
