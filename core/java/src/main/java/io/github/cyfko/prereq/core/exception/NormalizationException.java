package io.github.cyfko.prereq.core.exception;

/**
 * Raised when a prerequisite set would be built with no children.
 * <p>
 * Empty prerequisites are only ever represented by the dedicated sentinel; an empty set is a
 * construction error, whether it comes from the normalizer or from a decoded storage tuple.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class NormalizationException extends PrerequisiteException {

    public NormalizationException(String message) {
        super(message);
    }

    public NormalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
