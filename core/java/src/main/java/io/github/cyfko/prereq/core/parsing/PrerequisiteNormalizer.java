package io.github.cyfko.prereq.core.parsing;

import io.github.cyfko.prereq.core.exception.NormalizationException;
import io.github.cyfko.prereq.core.model.Clause;
import io.github.cyfko.prereq.core.model.Course;
import io.github.cyfko.prereq.core.model.Operator;
import io.github.cyfko.prereq.core.model.PrerequisiteSet;
import io.github.cyfko.prereq.core.model.Prerequisites;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Canonicalizes trees into the storage/display form.
 * <ol>
 *   <li>Consecutive applications of one operator are flattened into a single n-ary set:
 *       {@code A or B or C} is one OR set of three clauses.</li>
 *   <li>Duplicate clauses within a set are removed, comparing course ids case-insensitively together
 *       with grade and concurrency; the first occurrence is kept.</li>
 *   <li>A set left with one clause is replaced by that clause, except at the root, where a lone course
 *       is held in a one-child AND set.</li>
 * </ol>
 * <p>
 * Catalog order is never changed. Normalizing an already normalized value returns an equal value.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PrerequisiteNormalizer {

    private PrerequisiteNormalizer() {}

    /**
     * @param root raw parse tree, {@code null} meaning no prerequisite text
     * @return the canonical prerequisites
     * @throws NormalizationException if a set would end up with no clauses
     */
    public static Prerequisites normalize(ParseNode root) {
        if (root == null) {
            return Prerequisites.none();
        }
        return wrap(canonical(toClause(root)));
    }

    /**
     * Re-canonicalizes a value, e.g. one decoded from storage.
     *
     * @param prerequisites any prerequisites value
     * @return the canonical equivalent
     */
    public static Prerequisites normalize(Prerequisites prerequisites) {
        return prerequisites.root()
                .map(root -> wrap(canonical(root)))
                .orElse(Prerequisites.none());
    }

    private static Clause toClause(ParseNode node) {
        if (node instanceof ParseNode.CourseNode courseNode) {
            return courseNode.course();
        }

        ParseNode.BinaryNode binary = (ParseNode.BinaryNode) node;
        Operator operator = binary.operator();
        List<Clause> children = new ArrayList<>();

        // Left-deep same-operator chains can be long; walk them with an explicit stack.
        Deque<ParseNode> pending = new ArrayDeque<>();
        pending.push(binary);
        while (!pending.isEmpty()) {
            ParseNode current = pending.pop();
            if (current instanceof ParseNode.BinaryNode inner && inner.operator() == operator) {
                pending.push(inner.right());
                pending.push(inner.left());
            } else {
                children.add(toClause(current));
            }
        }
        return new PrerequisiteSet(operator, children);
    }

    private static Clause canonical(Clause clause) {
        if (clause instanceof Course) {
            return clause;
        }

        PrerequisiteSet set = (PrerequisiteSet) clause;
        Map<String, Clause> unique = new LinkedHashMap<>();
        for (Clause child : set.children()) {
            Clause normalized = canonical(child);
            if (normalized instanceof PrerequisiteSet nested && nested.operator() == set.operator()) {
                for (Clause grandChild : nested.children()) {
                    unique.putIfAbsent(key(grandChild), grandChild);
                }
            } else {
                unique.putIfAbsent(key(normalized), normalized);
            }
        }

        if (unique.isEmpty()) {
            throw new NormalizationException("Set " + set.operator().symbol() + " has no clauses after normalization");
        }
        if (unique.size() == 1) {
            return unique.values().iterator().next();
        }
        return new PrerequisiteSet(set.operator(), new ArrayList<>(unique.values()));
    }

    private static Prerequisites wrap(Clause clause) {
        if (clause instanceof PrerequisiteSet set) {
            return Prerequisites.of(set);
        }
        return Prerequisites.of(new PrerequisiteSet(Operator.AND, List.of(clause)));
    }

    /**
     * Structural identity used for deduplication.
     */
    static String key(Clause clause) {
        if (clause instanceof Course course) {
            return course.requirementKey();
        }
        PrerequisiteSet set = (PrerequisiteSet) clause;
        return set.children().stream()
                .map(PrerequisiteNormalizer::key)
                .collect(Collectors.joining(",", set.operator().symbol() + "(", ")"));
    }
}
