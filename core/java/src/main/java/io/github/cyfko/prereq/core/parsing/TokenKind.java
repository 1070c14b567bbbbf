package io.github.cyfko.prereq.core.parsing;

/**
 * Lexical categories of catalog prerequisite text.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenKind {
    /** A course code such as {@code CS 1331}; the token value is the normalized id. */
    COURSE,
    /** {@code and}, or a comma acting as an implicit AND. */
    AND,
    OR,
    LPAREN,
    RPAREN,
    /** {@code Minimum Grade of X}; the token value is the grade symbol. */
    GRADE,
    /** A "may be taken concurrently" marker. */
    CONCURRENT;

    boolean isConnective() {
        return this == AND || this == OR;
    }

    boolean isCourseModifier() {
        return this == GRADE || this == CONCURRENT;
    }
}
