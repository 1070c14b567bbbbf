package io.github.cyfko.prereq.core.impl;

import io.github.cyfko.prereq.core.api.EligibilityEvaluator;
import io.github.cyfko.prereq.core.config.EvaluationPolicy;
import io.github.cyfko.prereq.core.eval.EvaluationNode;
import io.github.cyfko.prereq.core.eval.EvaluationResult;
import io.github.cyfko.prereq.core.eval.NodeStatus;
import io.github.cyfko.prereq.core.exception.DepthExceededException;
import io.github.cyfko.prereq.core.model.Clause;
import io.github.cyfko.prereq.core.model.Course;
import io.github.cyfko.prereq.core.model.CourseRecord;
import io.github.cyfko.prereq.core.model.Grade;
import io.github.cyfko.prereq.core.model.Operator;
import io.github.cyfko.prereq.core.model.PrerequisiteSet;
import io.github.cyfko.prereq.core.model.Prerequisites;
import io.github.cyfko.prereq.core.model.StudentRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Default {@link EligibilityEvaluator}.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li><strong>None</strong>: always satisfied ({@link NodeStatus#NOT_APPLICABLE} root).</li>
 *   <li><strong>Course</strong>: satisfied when completed (or in progress) with a grade meeting the
 *       minimum; an in-progress course without a grade is {@link NodeStatus#PENDING}. A planned course is
 *       pending only if it may be taken concurrently or {@link EvaluationPolicy#countPlannedAsPending()}
 *       is set. A completed course without a recorded grade meets only a grade-free requirement.</li>
 *   <li><strong>AND</strong>: every child evaluated; unsatisfied if any child is, else pending if any
 *       child is, else satisfied.</li>
 *   <li><strong>OR</strong>: every child evaluated; the explained branch is the first satisfied child,
 *       else the first pending child, else the child with the fewest unmet courses (first on ties).</li>
 * </ul>
 * <p>
 * Tree depth is checked iteratively before any recursion, so an oversized tree fails with
 * {@link DepthExceededException} in bounded time.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TreeWalkingEvaluator implements EligibilityEvaluator {

    private static final Logger log = Logger.getLogger(TreeWalkingEvaluator.class.getName());

    private final EvaluationPolicy policy;

    public TreeWalkingEvaluator() {
        this(EvaluationPolicy.defaults());
    }

    public TreeWalkingEvaluator(EvaluationPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "Evaluation policy is required");
    }

    @Override
    public EvaluationResult evaluate(Prerequisites prerequisites, StudentRecord record) {
        Objects.requireNonNull(prerequisites, "prerequisites are required");
        Objects.requireNonNull(record, "student record is required");

        Optional<PrerequisiteSet> root = prerequisites.root();
        if (root.isEmpty()) {
            EvaluationNode node = new EvaluationNode(null, NodeStatus.NOT_APPLICABLE, true, List.of());
            return new EvaluationResult(true, NodeStatus.NOT_APPLICABLE, node, List.of());
        }

        checkDepth(prerequisites);
        Walk walk = visit(root.get(), record);
        NodeStatus status = walk.node.status();
        boolean satisfied = status.counts();

        log.fine(() -> String.format("Evaluated %s -> %s (missing: %s)", prerequisites, status, walk.unmet));
        return new EvaluationResult(satisfied, status, walk.node.withSelectedFlag(true),
                satisfied ? List.of() : walk.unmet);
    }

    @Override
    public boolean isSatisfied(Prerequisites prerequisites, StudentRecord record) {
        Objects.requireNonNull(prerequisites, "prerequisites are required");
        Objects.requireNonNull(record, "student record is required");

        Optional<PrerequisiteSet> root = prerequisites.root();
        if (root.isEmpty()) {
            return true;
        }
        checkDepth(prerequisites);
        return holds(root.get(), record);
    }

    public EvaluationPolicy getPolicy() {
        return policy;
    }

    private boolean holds(Clause clause, StudentRecord record) {
        if (clause instanceof Course course) {
            return leafStatus(course, record).counts();
        }
        PrerequisiteSet set = (PrerequisiteSet) clause;
        return set.operator() == Operator.AND
                ? set.children().stream().allMatch(child -> holds(child, record))
                : set.children().stream().anyMatch(child -> holds(child, record));
    }

    private Walk visit(Clause clause, StudentRecord record) {
        if (clause instanceof Course course) {
            NodeStatus status = leafStatus(course, record);
            List<Course> unmet = status == NodeStatus.UNSATISFIED ? List.of(course) : List.of();
            return new Walk(new EvaluationNode(course, status, false, List.of()), unmet);
        }

        PrerequisiteSet set = (PrerequisiteSet) clause;
        List<Walk> walks = new ArrayList<>(set.children().size());
        for (Clause child : set.children()) {
            walks.add(visit(child, record));
        }

        return set.operator() == Operator.AND ? conjunction(set, walks) : disjunction(set, walks);
    }

    private Walk conjunction(PrerequisiteSet set, List<Walk> walks) {
        NodeStatus status = NodeStatus.SATISFIED;
        List<Course> unmet = new ArrayList<>();
        List<EvaluationNode> children = new ArrayList<>(walks.size());

        for (Walk walk : walks) {
            NodeStatus childStatus = walk.node.status();
            if (childStatus == NodeStatus.UNSATISFIED) {
                status = NodeStatus.UNSATISFIED;
                unmet.addAll(walk.unmet);
            } else if (childStatus == NodeStatus.PENDING && status == NodeStatus.SATISFIED) {
                status = NodeStatus.PENDING;
            }
            children.add(walk.node.withSelectedFlag(true));
        }
        return new Walk(new EvaluationNode(set, status, false, children), unmet);
    }

    private Walk disjunction(PrerequisiteSet set, List<Walk> walks) {
        int best = firstWithStatus(walks, NodeStatus.SATISFIED);
        if (best < 0) {
            best = firstWithStatus(walks, NodeStatus.PENDING);
        }
        if (best < 0) {
            best = 0;
            for (int i = 1; i < walks.size(); i++) {
                if (walks.get(i).unmet.size() < walks.get(best).unmet.size()) {
                    best = i;
                }
            }
        }

        List<EvaluationNode> children = new ArrayList<>(walks.size());
        for (int i = 0; i < walks.size(); i++) {
            children.add(walks.get(i).node.withSelectedFlag(i == best));
        }

        Walk chosen = walks.get(best);
        NodeStatus status = chosen.node.status();
        List<Course> unmet = status == NodeStatus.UNSATISFIED ? chosen.unmet : List.of();
        return new Walk(new EvaluationNode(set, status, false, children), unmet);
    }

    private static int firstWithStatus(List<Walk> walks, NodeStatus status) {
        for (int i = 0; i < walks.size(); i++) {
            if (walks.get(i).node.status() == status) {
                return i;
            }
        }
        return -1;
    }

    private NodeStatus leafStatus(Course course, StudentRecord record) {
        Optional<CourseRecord> found = record.lookup(course.id());
        if (found.isEmpty()) {
            return NodeStatus.UNSATISFIED;
        }

        CourseRecord courseRecord = found.get();
        return switch (courseRecord.status()) {
            case COMPLETED -> meets(courseRecord.grade(), course.grade())
                    ? NodeStatus.SATISFIED
                    : NodeStatus.UNSATISFIED;
            case IN_PROGRESS -> courseRecord.grade() == null || meets(courseRecord.grade(), course.grade())
                    ? NodeStatus.PENDING
                    : NodeStatus.UNSATISFIED;
            case PLANNED -> course.concurrent() || policy.countPlannedAsPending()
                    ? NodeStatus.PENDING
                    : NodeStatus.UNSATISFIED;
        };
    }

    private static boolean meets(Grade recorded, Grade required) {
        if (required == null) {
            return true;
        }
        return recorded != null && recorded.meets(required);
    }

    private void checkDepth(Prerequisites prerequisites) {
        if (prerequisites.depth() > policy.maxDepth()) {
            throw new DepthExceededException(policy.maxDepth());
        }
    }

    private static final class Walk {
        private final EvaluationNode node;
        private final List<Course> unmet;

        private Walk(EvaluationNode node, List<Course> unmet) {
            this.node = node;
            this.unmet = unmet;
        }
    }
}
