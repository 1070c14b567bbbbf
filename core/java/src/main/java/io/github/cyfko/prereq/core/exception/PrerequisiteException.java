package io.github.cyfko.prereq.core.exception;

/**
 * Base type of every failure raised while compiling or evaluating prerequisite logic.
 * <p>
 * All subtypes are unchecked. The strict entry points let them propagate; the batch entry point
 * ({@link io.github.cyfko.prereq.core.api.PrerequisiteCompiler#tryParse(String)}) captures them into
 * a per-course failure record instead.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PrerequisiteException extends RuntimeException {

    /**
     * @param message the message describing the failure
     */
    public PrerequisiteException(String message) {
        super(message);
    }

    /**
     * @param message the message describing the failure
     * @param cause   the underlying cause
     */
    public PrerequisiteException(String message, Throwable cause) {
        super(message, cause);
    }
}
