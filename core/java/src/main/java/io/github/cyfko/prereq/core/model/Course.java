package io.github.cyfko.prereq.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Leaf requirement on a single course.
 *
 * @param id         normalized course identifier, e.g. {@code "CS 2340"}
 * @param grade      minimum grade required, or {@code null} when any passing record counts
 * @param concurrent {@code true} when the course may be taken in the same term
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Course(String id, Grade grade, boolean concurrent) implements Clause {

    public Course {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Course id is required");
        }
    }

    public static Course of(String id) {
        return new Course(id, null, false);
    }

    public static Course of(String id, Grade grade) {
        return new Course(id, grade, false);
    }

    /**
     * Compares two course requirements using a case-insensitive course id.
     *
     * @param other the other requirement
     * @return {@code true} if both name the same course with the same grade and concurrency flag
     */
    public boolean sameRequirement(Course other) {
        return other != null
                && id.equalsIgnoreCase(other.id)
                && grade == other.grade
                && concurrent == other.concurrent;
    }

    /**
     * @return a key usable in hash-based collections that matches {@link #sameRequirement(Course)}
     */
    public String requirementKey() {
        return id.toUpperCase(Locale.ROOT) + '|' + Objects.toString(grade, "") + '|' + concurrent;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(id);
        if (grade != null) {
            sb.append(" (min ").append(grade).append(')');
        }
        if (concurrent) {
            sb.append(" [concurrent]");
        }
        return sb.toString();
    }
}
