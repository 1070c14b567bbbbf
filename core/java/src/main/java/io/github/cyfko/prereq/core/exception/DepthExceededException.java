package io.github.cyfko.prereq.core.exception;

/**
 * Raised when a prerequisite expression nests deeper than the configured maximum.
 * <p>
 * The parser (parenthesis nesting), the compiler and the evaluator (set nesting) enforce a bound so that
 * malformed or adversarial input fails fast instead of growing the call stack.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DepthExceededException extends PrerequisiteException {

    private final int maxDepth;

    /**
     * @param maxDepth the limit that was exceeded
     */
    public DepthExceededException(int maxDepth) {
        super("Prerequisite expression exceeds maximum nesting depth of " + maxDepth);
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
