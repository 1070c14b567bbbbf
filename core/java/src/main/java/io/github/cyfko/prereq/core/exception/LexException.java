package io.github.cyfko.prereq.core.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception thrown when raw prerequisite text contains spans that are neither course codes,
 * connectives, grade clauses, parentheses, concurrency markers nor discardable modifiers.
 * <p>
 * The lexer never stops at the first unrecognized span: every error found in the input is carried
 * here, in source order, so that a single report shows everything that needs fixing.
 * </p>
 *
 * <pre>{@code
 * compiler.parse("CS 1331 or SAT Math 620");
 * // -> "Unrecognized prerequisite text: 'SAT' at offset 11, 'Math' at offset 15, '620' at offset 20"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class LexException extends PrerequisiteException {

    private final List<LexError> errors;

    /**
     * @param errors the collected lexing errors, never empty
     * @throws IllegalArgumentException if {@code errors} is null or empty
     */
    public LexException(List<LexError> errors) {
        super(describe(errors));
        this.errors = List.copyOf(errors);
    }

    /**
     * @return every unrecognized span, in source order
     */
    public List<LexError> getErrors() {
        return errors;
    }

    private static String describe(List<LexError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("At least one lexing error is required");
        }
        return errors.stream()
                .map(LexError::toString)
                .collect(Collectors.joining(", ", "Unrecognized prerequisite text: ", ""));
    }
}
