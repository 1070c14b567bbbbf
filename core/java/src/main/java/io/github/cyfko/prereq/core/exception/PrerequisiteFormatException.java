package io.github.cyfko.prereq.core.exception;

/**
 * Raised when a stored tuple value does not have the {@code [operator, ...clauses]} /
 * {@code {"id": ...}} / {@code []} shape.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PrerequisiteFormatException extends PrerequisiteException {

    public PrerequisiteFormatException(String message) {
        super(message);
    }

    public PrerequisiteFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
