package io.github.cyfko.prereq.core.exception;

/**
 * Raised when a grade value lies outside the known scale ({@code A B C D F} and the pass/fail
 * markers {@code T S U V}).
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class GradeComparisonException extends PrerequisiteException {

    public GradeComparisonException(String message) {
        super(message);
    }
}
