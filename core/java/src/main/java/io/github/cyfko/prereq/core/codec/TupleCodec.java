package io.github.cyfko.prereq.core.codec;

import io.github.cyfko.prereq.core.config.ParserPolicy;
import io.github.cyfko.prereq.core.exception.DepthExceededException;
import io.github.cyfko.prereq.core.exception.NormalizationException;
import io.github.cyfko.prereq.core.exception.PrerequisiteFormatException;
import io.github.cyfko.prereq.core.model.Clause;
import io.github.cyfko.prereq.core.model.Course;
import io.github.cyfko.prereq.core.model.Grade;
import io.github.cyfko.prereq.core.model.Operator;
import io.github.cyfko.prereq.core.model.PrerequisiteSet;
import io.github.cyfko.prereq.core.model.Prerequisites;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts prerequisites to and from the compact tuple form consumed by the crawled dataset and the
 * badge renderer.
 *
 * <h2>Tuple Form</h2>
 * <table border="1">
 * <caption>Shapes</caption>
 * <tr><th>Value</th><th>Encoding</th></tr>
 * <tr><td>No prerequisites</td><td>{@code []}</td></tr>
 * <tr><td>Set</td><td>{@code ["and" | "or", clause, ...]}</td></tr>
 * <tr><td>Course</td><td>{@code {"id": "CS 1331", "grade": "C"}}, plus {@code "concurrent": true} when set</td></tr>
 * </table>
 * <p>
 * Encoded values are plain {@link List}/{@link Map}/{@link String}/{@link Boolean} graphs, ready for any
 * JSON binding. On decoding, a root list whose first element is not an operator is read as an implicit
 * AND of its elements, e.g. {@code [{"id": "MATH 1554", "grade": "C"}]}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TupleCodec {

    public static final String ID = "id";
    public static final String GRADE = "grade";
    public static final String CONCURRENT = "concurrent";

    private TupleCodec() {}

    /**
     * @param prerequisites the value to encode
     * @return the tuple form, a {@code List}
     */
    public static List<Object> encode(Prerequisites prerequisites) {
        return prerequisites.root()
                .map(root -> (List<Object>) encodeSet(root))
                .orElseGet(ArrayList::new);
    }

    /**
     * @param clause a course or set
     * @return a {@code Map} for a course, a {@code List} for a set
     */
    public static Object encodeClause(Clause clause) {
        if (clause instanceof Course course) {
            Map<String, Object> leaf = new LinkedHashMap<>();
            leaf.put(ID, course.id());
            if (course.grade() != null) {
                leaf.put(GRADE, course.grade().name());
            }
            if (course.concurrent()) {
                leaf.put(CONCURRENT, Boolean.TRUE);
            }
            return leaf;
        }
        return encodeSet((PrerequisiteSet) clause);
    }

    private static List<Object> encodeSet(PrerequisiteSet set) {
        List<Object> tuple = new ArrayList<>(set.children().size() + 1);
        tuple.add(set.operator().symbol());
        for (Clause child : set.children()) {
            tuple.add(encodeClause(child));
        }
        return tuple;
    }

    public static Prerequisites decode(Object value) {
        return decode(value, ParserPolicy.DEFAULT_MAX_DEPTH);
    }

    /**
     * @param value    tuple form as produced by a JSON binding
     * @param maxDepth maximum set nesting below the root
     * @return the decoded prerequisites, in stored order and shape
     * @throws PrerequisiteFormatException if the shape is not a tuple form
     * @throws NormalizationException      if a set has no clauses
     * @throws DepthExceededException      if sets nest deeper than {@code maxDepth}
     * @throws io.github.cyfko.prereq.core.exception.GradeComparisonException if a grade is off the scale
     */
    public static Prerequisites decode(Object value, int maxDepth) {
        if (!(value instanceof List<?> list)) {
            throw new PrerequisiteFormatException("Prerequisites must be encoded as an array, got: " + describe(value));
        }
        if (list.isEmpty()) {
            return Prerequisites.none();
        }
        if (list.get(0) instanceof String) {
            return Prerequisites.of(decodeSet(list, 0, maxDepth));
        }
        List<Clause> children = new ArrayList<>(list.size());
        for (Object element : list) {
            children.add(decodeClause(element, 1, maxDepth));
        }
        return Prerequisites.of(new PrerequisiteSet(Operator.AND, children));
    }

    private static Clause decodeClause(Object value, int depth, int maxDepth) {
        if (value instanceof Map<?, ?> map) {
            return decodeCourse(map);
        }
        if (value instanceof List<?> list) {
            return decodeSet(list, depth, maxDepth);
        }
        throw new PrerequisiteFormatException("Expected a course object or a set array, got: " + describe(value));
    }

    private static PrerequisiteSet decodeSet(List<?> tuple, int depth, int maxDepth) {
        if (depth > maxDepth) {
            throw new DepthExceededException(maxDepth);
        }
        if (tuple.isEmpty()) {
            throw new NormalizationException("Nested prerequisite set is empty");
        }
        if (!(tuple.get(0) instanceof String symbol)) {
            throw new PrerequisiteFormatException("A set must start with \"and\" or \"or\", got: " + describe(tuple.get(0)));
        }

        Operator operator;
        try {
            operator = Operator.fromSymbol(symbol);
        } catch (IllegalArgumentException e) {
            throw new PrerequisiteFormatException("A set must start with \"and\" or \"or\", got: \"" + symbol + "\"", e);
        }

        List<Clause> children = new ArrayList<>(tuple.size() - 1);
        for (Object element : tuple.subList(1, tuple.size())) {
            children.add(decodeClause(element, depth + 1, maxDepth));
        }
        return new PrerequisiteSet(operator, children);
    }

    private static Course decodeCourse(Map<?, ?> map) {
        if (!(map.get(ID) instanceof String id) || id.isBlank()) {
            throw new PrerequisiteFormatException("A course must have a non-blank \"id\", got: " + map);
        }

        Object grade = map.get(GRADE);
        if (grade != null && !(grade instanceof String)) {
            throw new PrerequisiteFormatException("Course grade must be a string, got: " + describe(grade));
        }

        Object concurrent = map.get(CONCURRENT);
        if (concurrent != null && !(concurrent instanceof Boolean)) {
            throw new PrerequisiteFormatException("Course concurrent flag must be a boolean, got: " + describe(concurrent));
        }

        return new Course(id.trim(),
                grade == null ? null : Grade.fromSymbol((String) grade),
                Boolean.TRUE.equals(concurrent));
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
    }
}
