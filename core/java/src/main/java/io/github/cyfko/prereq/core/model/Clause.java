package io.github.cyfko.prereq.core.model;

/**
 * A node of a prerequisite tree: either a single {@link Course} requirement or a
 * {@link PrerequisiteSet} grouping further clauses.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface Clause permits Course, PrerequisiteSet {
}
