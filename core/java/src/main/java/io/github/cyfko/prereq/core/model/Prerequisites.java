package io.github.cyfko.prereq.core.model;

import java.util.AbstractMap;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The prerequisites of one course in one catalog term.
 * <p>
 * Either the {@linkplain #none() empty sentinel} or a root {@link PrerequisiteSet}. The root is never a
 * bare course: a single requirement is held as a one-child AND set so that every consumer sees the
 * same root shape. Instances are immutable; a later crawl supersedes them with a new value.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Prerequisites {

    private static final Prerequisites NONE = new Prerequisites(null);

    private final PrerequisiteSet root;

    private Prerequisites(PrerequisiteSet root) {
        this.root = root;
    }

    /**
     * @return the sentinel meaning "no prerequisites"
     */
    public static Prerequisites none() {
        return NONE;
    }

    /**
     * @param root the root set
     * @return prerequisites rooted at {@code root}
     */
    public static Prerequisites of(PrerequisiteSet root) {
        return new Prerequisites(Objects.requireNonNull(root, "root set is required"));
    }

    public boolean isNone() {
        return root == null;
    }

    public Optional<PrerequisiteSet> root() {
        return Optional.ofNullable(root);
    }

    /**
     * Set nesting below the root, measured with an explicit stack. The root set is level 0, so a flat
     * group of courses has depth 0; the sentinel also has depth 0.
     *
     * @return the level of the most deeply nested set
     */
    public int depth() {
        if (root == null) {
            return 0;
        }
        int deepest = 0;
        Deque<Map.Entry<PrerequisiteSet, Integer>> pending = new ArrayDeque<>();
        pending.push(new AbstractMap.SimpleImmutableEntry<>(root, 0));
        while (!pending.isEmpty()) {
            Map.Entry<PrerequisiteSet, Integer> entry = pending.pop();
            int level = entry.getValue();
            deepest = Math.max(deepest, level);
            for (Clause child : entry.getKey().children()) {
                if (child instanceof PrerequisiteSet nested) {
                    pending.push(new AbstractMap.SimpleImmutableEntry<>(nested, level + 1));
                }
            }
        }
        return deepest;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Prerequisites)) return false;
        return Objects.equals(root, ((Prerequisites) o).root);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(root);
    }

    @Override
    public String toString() {
        return root == null ? "Prerequisites[none]" : "Prerequisites" + root;
    }
}
