package io.github.cyfko.prereq.core.config;

/**
 * Settings of the eligibility evaluator.
 *
 * @param maxDepth              maximum number of sets nested below the root (the root itself is level 0)
 * @param countPlannedAsPending whether planned courses count as pending, as when validating a future
 *                              semester of a degree plan
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EvaluationPolicy(int maxDepth, boolean countPlannedAsPending) {

    public EvaluationPolicy {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
    }

    /**
     * Registration check: only completed and in-progress courses count.
     *
     * @return default configuration (depth 10)
     */
    public static EvaluationPolicy defaults() {
        return new EvaluationPolicy(ParserPolicy.DEFAULT_MAX_DEPTH, false);
    }

    /**
     * Plan check: courses planned for earlier semesters count as pending.
     *
     * @return planning configuration (depth 10)
     */
    public static EvaluationPolicy planning() {
        return new EvaluationPolicy(ParserPolicy.DEFAULT_MAX_DEPTH, true);
    }
}
