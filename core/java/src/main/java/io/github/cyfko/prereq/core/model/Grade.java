package io.github.cyfko.prereq.core.model;

import io.github.cyfko.prereq.core.exception.GradeComparisonException;

import java.util.Optional;

/**
 * Grade scale used both for catalog minimum-grade requirements and for recorded grades.
 * <p>
 * Letter grades form a total order {@code A > B > C > D > F}. The markers {@code T} (transfer),
 * {@code S} (satisfactory), {@code U} (unsatisfactory) and {@code V} (audit) are never ordered against
 * letters: a marker requirement is met only by the identical marker.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Grade {
    A(4),
    B(3),
    C(2),
    D(1),
    F(0),
    T(-1),
    S(-1),
    U(-1),
    V(-1);

    private final int rank;

    Grade(int rank) {
        this.rank = rank;
    }

    /**
     * @return {@code true} for {@code A..F}, {@code false} for pass/fail markers
     */
    public boolean isLetter() {
        return rank >= 0;
    }

    /**
     * Tells whether this recorded grade meets the given minimum requirement.
     *
     * @param required the catalog requirement
     * @return {@code true} if this grade is a letter at least as high as a letter requirement, or the
     *         identical marker for a marker requirement
     */
    public boolean meets(Grade required) {
        if (required.isLetter()) {
            return isLetter() && rank >= required.rank;
        }
        return this == required;
    }

    /**
     * Parses a grade symbol, ignoring case and surrounding whitespace.
     *
     * @param symbol the grade symbol
     * @return the grade
     * @throws GradeComparisonException if the symbol is not on the scale
     */
    public static Grade fromSymbol(String symbol) {
        return lookup(symbol).orElseThrow(() -> new GradeComparisonException(
                "Grade '" + symbol + "' is outside the known scale (A B C D F T S U V)"));
    }

    /**
     * @param symbol the grade symbol
     * @return the grade, or empty if the symbol is not on the scale
     */
    public static Optional<Grade> lookup(String symbol) {
        if (symbol != null) {
            String trimmed = symbol.trim();
            if (trimmed.length() == 1) {
                for (Grade grade : values()) {
                    if (grade.name().equalsIgnoreCase(trimmed)) {
                        return Optional.of(grade);
                    }
                }
            }
        }
        return Optional.empty();
    }
}
