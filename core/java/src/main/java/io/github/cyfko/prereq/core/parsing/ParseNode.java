package io.github.cyfko.prereq.core.parsing;

import io.github.cyfko.prereq.core.model.Course;
import io.github.cyfko.prereq.core.model.Operator;

import java.util.Objects;

/**
 * Raw parse tree produced by {@link PrerequisiteParser}: course leaves joined by binary connective
 * nodes, exactly as grouped by the active {@link GroupingPolicy}. Flattening into n-ary sets is the
 * job of {@link PrerequisiteNormalizer}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface ParseNode permits ParseNode.CourseNode, ParseNode.BinaryNode {

    /**
     * @param course the course requirement with its grade and concurrency modifiers applied
     * @param offset source offset of the course code
     */
    record CourseNode(Course course, int offset) implements ParseNode {
        public CourseNode {
            Objects.requireNonNull(course, "course is required");
        }
    }

    record BinaryNode(Operator operator, ParseNode left, ParseNode right) implements ParseNode {
        public BinaryNode {
            Objects.requireNonNull(operator, "operator is required");
            Objects.requireNonNull(left, "left operand is required");
            Objects.requireNonNull(right, "right operand is required");
        }
    }
}
