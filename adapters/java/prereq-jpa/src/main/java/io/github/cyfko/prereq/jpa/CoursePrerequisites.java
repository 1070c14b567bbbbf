package io.github.cyfko.prereq.jpa;

import io.github.cyfko.prereq.core.api.EligibilityEvaluator;
import io.github.cyfko.prereq.core.api.ParseOutcome;
import io.github.cyfko.prereq.core.batch.CourseParseRecord;
import io.github.cyfko.prereq.core.eval.CourseEligibility;
import io.github.cyfko.prereq.core.exception.PrerequisiteException;
import io.github.cyfko.prereq.core.model.Prerequisites;
import io.github.cyfko.prereq.core.model.StudentRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;

import java.util.Objects;
import java.util.Optional;

/**
 * Prerequisites of one course for one catalog term, as persisted by the crawl.
 * <p>
 * Embed it in the course entity of the dataset:
 * </p>
 * <pre>{@code
 * @Entity
 * class CatalogCourse {
 *     @Id String courseId;
 *     @Embedded CoursePrerequisites prerequisites;
 * }
 * }</pre>
 * <p>
 * A course whose text failed to compile keeps its raw text and error message, with a {@code NULL}
 * tree. It is reported as undetermined and never as having no prerequisites.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@Embeddable
public class CoursePrerequisites {

    public static final String UNKNOWN_REASON = "Prerequisites unknown";

    @Column(name = "prereq_term", length = 16)
    private String term;

    @Column(name = "prereq_raw_text", length = 5000)
    private String rawText;

    @Convert(converter = PrerequisitesConverter.class)
    @Column(name = "prereq_tree", length = 8000)
    private Prerequisites prerequisites;

    @Column(name = "prereq_error", length = 1000)
    private String parseError;

    protected CoursePrerequisites() {}

    private CoursePrerequisites(String term, String rawText, Prerequisites prerequisites, String parseError) {
        this.term = term;
        this.rawText = rawText;
        this.prerequisites = prerequisites;
        this.parseError = parseError;
    }

    public static CoursePrerequisites known(String term, String rawText, Prerequisites prerequisites) {
        return new CoursePrerequisites(term, rawText, Objects.requireNonNull(prerequisites, "prerequisites are required"), null);
    }

    public static CoursePrerequisites unknown(String term, String rawText, String parseError) {
        return new CoursePrerequisites(term, rawText, null, parseError == null ? UNKNOWN_REASON : parseError);
    }

    /**
     * @param record  a batch record
     * @param rawText the text the record was compiled from
     * @return the storable form of the record
     */
    public static CoursePrerequisites from(CourseParseRecord record, String rawText) {
        return record.outcome().value()
                .map(p -> known(record.term(), rawText, p))
                .orElseGet(() -> unknown(record.term(), rawText, record.errorMessage()));
    }

    public boolean isKnown() {
        return prerequisites != null;
    }

    public Optional<Prerequisites> getPrerequisites() {
        return Optional.ofNullable(prerequisites);
    }

    /**
     * @return the stored value as a compile outcome; unknown prerequisites become {@link ParseOutcome.Failed}
     */
    public ParseOutcome toOutcome() {
        if (prerequisites != null) {
            return ParseOutcome.parsed(prerequisites);
        }
        return ParseOutcome.failed(new PrerequisiteException(parseError == null ? UNKNOWN_REASON : parseError));
    }

    /**
     * @param courseId  the course these prerequisites belong to
     * @param record    the student's history
     * @param evaluator the evaluator to apply
     * @return the verdict, {@link CourseEligibility.Verdict#UNDETERMINED} when unknown
     */
    public CourseEligibility check(String courseId, StudentRecord record, EligibilityEvaluator evaluator) {
        return prerequisites == null
                ? CourseEligibility.undetermined(courseId)
                : CourseEligibility.of(courseId, evaluator.evaluate(prerequisites, record));
    }

    public String getTerm() {
        return term;
    }

    public String getRawText() {
        return rawText;
    }

    public String getParseError() {
        return parseError;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CoursePrerequisites)) return false;
        CoursePrerequisites that = (CoursePrerequisites) o;
        return Objects.equals(term, that.term)
                && Objects.equals(rawText, that.rawText)
                && Objects.equals(prerequisites, that.prerequisites)
                && Objects.equals(parseError, that.parseError);
    }

    @Override
    public int hashCode() {
        return Objects.hash(term, rawText, prerequisites, parseError);
    }
}
