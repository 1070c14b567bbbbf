package io.github.cyfko.prereq.core.eval;

import io.github.cyfko.prereq.core.model.Course;

import java.util.List;

/**
 * Outcome of evaluating prerequisites against a student record.
 *
 * @param satisfied {@code true} when the root is satisfied or pending
 * @param status    the root verdict
 * @param root      the full explanation tree
 * @param missing   unmet course requirements along the single most nearly satisfied path, in catalog
 *                  order; empty when {@code satisfied}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EvaluationResult(boolean satisfied, NodeStatus status, EvaluationNode root, List<Course> missing) {

    public EvaluationResult {
        missing = List.copyOf(missing);
    }

    /**
     * @return {@code true} when the result relies on at least one in-progress or planned course
     */
    public boolean isPending() {
        return status == NodeStatus.PENDING;
    }
}
