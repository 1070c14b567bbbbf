package io.github.cyfko.prereq.core.api;

import io.github.cyfko.prereq.core.eval.EvaluationResult;
import io.github.cyfko.prereq.core.model.Prerequisites;
import io.github.cyfko.prereq.core.model.StudentRecord;

/**
 * Decides whether a student's course history satisfies a prerequisite tree.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see io.github.cyfko.prereq.core.impl.TreeWalkingEvaluator
 */
public interface EligibilityEvaluator {

    /**
     * Evaluates every node of the tree and explains the verdict.
     *
     * @param prerequisites the compiled prerequisites
     * @param record        the student's course history
     * @return the verdict with its explanation tree and unmet requirements
     * @throws io.github.cyfko.prereq.core.exception.DepthExceededException if the tree is too deep
     */
    EvaluationResult evaluate(Prerequisites prerequisites, StudentRecord record);

    /**
     * Boolean-only variant of {@link #evaluate(Prerequisites, StudentRecord)}, free to short-circuit.
     *
     * @param prerequisites the compiled prerequisites
     * @param record        the student's course history
     * @return {@code true} when satisfied or pending
     */
    boolean isSatisfied(Prerequisites prerequisites, StudentRecord record);
}
