package io.github.cyfko.prereq.core.analysis;

import io.github.cyfko.prereq.core.api.EligibilityEvaluator;
import io.github.cyfko.prereq.core.api.ParseOutcome;
import io.github.cyfko.prereq.core.eval.CourseEligibility;
import io.github.cyfko.prereq.core.impl.TreeWalkingEvaluator;
import io.github.cyfko.prereq.core.model.Clause;
import io.github.cyfko.prereq.core.model.Course;
import io.github.cyfko.prereq.core.model.PrerequisiteSet;
import io.github.cyfko.prereq.core.model.Prerequisites;
import io.github.cyfko.prereq.core.model.StudentRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Catalog-wide queries over compiled prerequisites used by the planner.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PrerequisiteAnalysis {

    /** Courses missing at least this many requirements are reported as critical blocks. */
    public static final int CRITICAL_MISSING_THRESHOLD = 2;

    private PrerequisiteAnalysis() {}

    /**
     * @param prerequisites a compiled value
     * @return every course id referenced anywhere in the tree, distinct and sorted
     */
    public static List<String> referencedCourses(Prerequisites prerequisites) {
        TreeSet<String> ids = new TreeSet<>();
        prerequisites.root().ifPresent(root -> {
            Deque<Clause> pending = new ArrayDeque<>();
            pending.push(root);
            while (!pending.isEmpty()) {
                Clause clause = pending.pop();
                if (clause instanceof Course course) {
                    ids.add(course.id());
                } else {
                    ((PrerequisiteSet) clause).children().forEach(pending::push);
                }
            }
        });
        return new ArrayList<>(ids);
    }

    /**
     * @param courseId a course id
     * @param catalog  compiled prerequisites keyed by course id
     * @return ids of the catalog courses whose prerequisites reference {@code courseId}, in catalog order
     */
    public static List<String> unlockedBy(String courseId, Map<String, Prerequisites> catalog) {
        Objects.requireNonNull(courseId, "courseId is required");
        return catalog.entrySet().stream()
                .filter(e -> referencedCourses(e.getValue()).stream().anyMatch(courseId::equalsIgnoreCase))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    /**
     * Checks every course of a catalog; courses whose prerequisites are unknown are
     * {@link CourseEligibility.Verdict#UNDETERMINED}.
     *
     * @param catalog   compile outcomes keyed by course id
     * @param record    the student's history
     * @param evaluator the evaluator to apply
     * @return eligibility keyed by course id, in catalog order
     */
    public static Map<String, CourseEligibility> checkAll(Map<String, ParseOutcome> catalog,
                                                          StudentRecord record,
                                                          EligibilityEvaluator evaluator) {
        Map<String, CourseEligibility> checks = new LinkedHashMap<>();
        catalog.forEach((courseId, outcome) -> checks.put(courseId, outcome.value()
                .map(p -> CourseEligibility.of(courseId, evaluator.evaluate(p, record)))
                .orElseGet(() -> CourseEligibility.undetermined(courseId))));
        return checks;
    }

    public static List<String> eligibleCourses(Map<String, ParseOutcome> catalog, StudentRecord record) {
        return eligibleCourses(catalog, record, new TreeWalkingEvaluator());
    }

    /**
     * @param catalog   compile outcomes keyed by course id
     * @param record    the student's history
     * @param evaluator the evaluator to apply
     * @return sorted ids of the courses absent from the record whose prerequisites are satisfied or pending
     */
    public static List<String> eligibleCourses(Map<String, ParseOutcome> catalog,
                                               StudentRecord record,
                                               EligibilityEvaluator evaluator) {
        Map<String, ParseOutcome> untaken = new LinkedHashMap<>();
        catalog.forEach((courseId, outcome) -> {
            if (record.lookup(courseId).isEmpty()) {
                untaken.put(courseId, outcome);
            }
        });
        return checkAll(untaken, record, evaluator).values().stream()
                .filter(CourseEligibility::isEligible)
                .map(CourseEligibility::courseId)
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * @param checks results of {@link #checkAll(Map, StudentRecord, EligibilityEvaluator)}
     * @return ids of ineligible courses missing {@value #CRITICAL_MISSING_THRESHOLD} or more requirements
     */
    public static List<String> criticalBlocks(Map<String, CourseEligibility> checks) {
        return checks.values().stream()
                .filter(check -> check.verdict() == CourseEligibility.Verdict.INELIGIBLE)
                .filter(check -> check.missing().size() >= CRITICAL_MISSING_THRESHOLD)
                .map(CourseEligibility::courseId)
                .collect(Collectors.toList());
    }
}
