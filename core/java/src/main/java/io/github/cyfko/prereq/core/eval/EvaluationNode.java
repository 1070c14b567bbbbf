package io.github.cyfko.prereq.core.eval;

import io.github.cyfko.prereq.core.model.Clause;

import java.util.List;

/**
 * One node of the explanation tree, mirroring the evaluated prerequisite tree clause for clause.
 *
 * @param clause   the evaluated clause, {@code null} for the root of the empty sentinel
 * @param status   the verdict for this clause
 * @param selected {@code true} when this node is on the explained path below its parent: every child of
 *                 an AND, and only the chosen branch of an OR (the satisfying one, or else the most nearly
 *                 satisfied one)
 * @param children evaluations of the clause's children, in catalog order (empty for a course)
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EvaluationNode(Clause clause, NodeStatus status, boolean selected, List<EvaluationNode> children) {

    public EvaluationNode {
        children = List.copyOf(children);
    }

    public EvaluationNode withSelectedFlag(boolean selected) {
        return selected == this.selected ? this : new EvaluationNode(clause, status, selected, children);
    }
}
