package io.github.cyfko.prereq.core.model;

import java.util.Locale;

/**
 * Logical operator of a {@link PrerequisiteSet}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Operator {
    AND,
    OR;

    /**
     * @return the lower-case symbol used in the stored tuple form ({@code "and"} / {@code "or"})
     */
    public String symbol() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves an operator from its tuple symbol, ignoring case.
     *
     * @param symbol {@code "and"} or {@code "or"}
     * @return the operator
     * @throws IllegalArgumentException if the symbol is not a known operator
     */
    public static Operator fromSymbol(String symbol) {
        if (symbol != null) {
            for (Operator op : values()) {
                if (op.name().equalsIgnoreCase(symbol)) {
                    return op;
                }
            }
        }
        throw new IllegalArgumentException("Unknown prerequisite operator: " + symbol);
    }
}
