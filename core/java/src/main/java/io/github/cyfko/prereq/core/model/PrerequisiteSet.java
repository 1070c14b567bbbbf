package io.github.cyfko.prereq.core.model;

import io.github.cyfko.prereq.core.exception.NormalizationException;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An AND/OR group of one or more clauses, in catalog order.
 * <p>
 * Child order carries no logical meaning but is preserved because display consumers render
 * left-to-right.
 * </p>
 *
 * @param operator the group operator
 * @param children the grouped clauses, never empty
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record PrerequisiteSet(Operator operator, List<Clause> children) implements Clause {

    /**
     * @throws NormalizationException if {@code children} is empty
     */
    public PrerequisiteSet {
        Objects.requireNonNull(operator, "operator is required");
        Objects.requireNonNull(children, "children are required");
        if (children.isEmpty()) {
            throw new NormalizationException("A prerequisite set must have at least one clause");
        }
        children = List.copyOf(children);
    }

    public static PrerequisiteSet and(Clause... children) {
        return new PrerequisiteSet(Operator.AND, List.of(children));
    }

    public static PrerequisiteSet or(Clause... children) {
        return new PrerequisiteSet(Operator.OR, List.of(children));
    }

    @Override
    public String toString() {
        return children.stream()
                .map(Object::toString)
                .collect(Collectors.joining(", ", "[" + operator.symbol() + ": ", "]"));
    }
}
