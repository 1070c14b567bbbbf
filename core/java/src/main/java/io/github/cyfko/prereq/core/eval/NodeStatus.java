package io.github.cyfko.prereq.core.eval;

/**
 * Verdict attached to every node of an evaluated prerequisite tree.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum NodeStatus {
    /** Met by completed coursework. */
    SATISFIED,
    /** Met structurally by in-progress (or, when allowed, planned) coursework; not yet a hard completion. */
    PENDING,
    UNSATISFIED,
    /** Nothing to evaluate: the root of an empty prerequisite list. */
    NOT_APPLICABLE;

    /**
     * @return {@code true} for {@link #SATISFIED}, {@link #PENDING} and {@link #NOT_APPLICABLE}
     */
    public boolean counts() {
        return this != UNSATISFIED;
    }
}
