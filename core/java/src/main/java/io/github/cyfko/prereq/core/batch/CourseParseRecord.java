package io.github.cyfko.prereq.core.batch;

import io.github.cyfko.prereq.core.api.ParseOutcome;

import java.util.Objects;

/**
 * Compilation outcome for one course of one crawled term.
 *
 * @param term     catalog term identifier, e.g. {@code "202508"}
 * @param courseId course identifier
 * @param outcome  compiled prerequisites, or the failure that leaves them unknown
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CourseParseRecord(String term, String courseId, ParseOutcome outcome) {

    public CourseParseRecord {
        Objects.requireNonNull(courseId, "courseId is required");
        Objects.requireNonNull(outcome, "outcome is required");
    }

    /**
     * @return {@code true} when the prerequisites could not be determined
     */
    public boolean isUnknown() {
        return !outcome.ok();
    }

    /**
     * @return the failure message, or {@code null} when parsing succeeded
     */
    public String errorMessage() {
        return outcome.error().map(Throwable::getMessage).orElse(null);
    }
}
