package io.github.cyfko.prereq.core.eval;

import io.github.cyfko.prereq.core.model.Course;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Registration eligibility of one course for one student, ready for display.
 * <p>
 * A course whose prerequisites could not be compiled is {@link Verdict#UNDETERMINED}, never eligible:
 * treating unknown prerequisites as "none" would tell a student they may register when they may not.
 * </p>
 *
 * @param courseId the course being checked
 * @param verdict  overall verdict
 * @param message  human readable explanation
 * @param result   the evaluation, {@code null} when {@link Verdict#UNDETERMINED}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CourseEligibility(String courseId, Verdict verdict, String message, EvaluationResult result) {

    public static final String UNDETERMINED_MESSAGE = "prerequisites could not be determined — consult the catalog";

    public enum Verdict {
        ELIGIBLE,
        /** Eligible provided in-progress courses are completed. */
        PENDING,
        INELIGIBLE,
        UNDETERMINED
    }

    public CourseEligibility {
        Objects.requireNonNull(courseId, "courseId is required");
        Objects.requireNonNull(verdict, "verdict is required");
    }

    /**
     * @param courseId the course being checked
     * @param result   the evaluation of its prerequisites
     * @return the matching eligibility
     */
    public static CourseEligibility of(String courseId, EvaluationResult result) {
        Objects.requireNonNull(result, "result is required");
        if (!result.satisfied()) {
            String missing = result.missing().stream().map(Course::toString).collect(Collectors.joining(", "));
            return new CourseEligibility(courseId, Verdict.INELIGIBLE, "Missing prerequisites: " + missing, result);
        }
        if (result.isPending()) {
            return new CourseEligibility(courseId, Verdict.PENDING, "Eligible once in-progress courses are completed", result);
        }
        return new CourseEligibility(courseId, Verdict.ELIGIBLE, "Prerequisites satisfied", result);
    }

    public static CourseEligibility undetermined(String courseId) {
        return new CourseEligibility(courseId, Verdict.UNDETERMINED, UNDETERMINED_MESSAGE, null);
    }

    public boolean isEligible() {
        return verdict == Verdict.ELIGIBLE || verdict == Verdict.PENDING;
    }

    /**
     * @return unmet requirements, empty when eligible or undetermined
     */
    public List<Course> missing() {
        return result == null ? List.of() : result.missing();
    }
}
