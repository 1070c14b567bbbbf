package io.github.cyfko.prereq.core.codec;

import io.github.cyfko.prereq.core.model.Clause;
import io.github.cyfko.prereq.core.model.Course;
import io.github.cyfko.prereq.core.model.Operator;
import io.github.cyfko.prereq.core.model.PrerequisiteSet;
import io.github.cyfko.prereq.core.model.Prerequisites;

import java.util.stream.Collectors;

/**
 * Renders prerequisites as one line of English for listings and exports.
 *
 * <pre>{@code
 * ReadableFormatter.toReadable(Prerequisites.none());   // "No prerequisites"
 * ReadableFormatter.toReadable(p);                      // "CS 1331 OR (CS 1301 AND MATH 1554)"
 * ReadableFormatter.toReadable(p, true);                // "CS 1331 (C) OR (CS 1301 (C) AND MATH 1554)"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ReadableFormatter {

    public static final String NO_PREREQUISITES = "No prerequisites";

    private ReadableFormatter() {}

    public static String toReadable(Prerequisites prerequisites) {
        return toReadable(prerequisites, false);
    }

    /**
     * @param prerequisites the value to render
     * @param withGrades    whether minimum grades and concurrency are shown
     * @return the rendered text
     */
    public static String toReadable(Prerequisites prerequisites, boolean withGrades) {
        return prerequisites.root()
                .map(root -> render(root, null, withGrades))
                .orElse(NO_PREREQUISITES);
    }

    private static String render(Clause clause, Operator parent, boolean withGrades) {
        if (clause instanceof Course course) {
            if (!withGrades) {
                return course.id();
            }
            String text = course.grade() == null ? course.id() : course.id() + " (" + course.grade() + ")";
            return course.concurrent() ? text + " [concurrent]" : text;
        }

        PrerequisiteSet set = (PrerequisiteSet) clause;
        if (set.children().size() == 1) {
            return render(set.children().get(0), parent, withGrades);
        }

        String joined = set.children().stream()
                .map(child -> render(child, set.operator(), withGrades))
                .collect(Collectors.joining(set.operator() == Operator.AND ? " AND " : " OR "));
        return parent != null && parent != set.operator() ? "(" + joined + ")" : joined;
    }
}
