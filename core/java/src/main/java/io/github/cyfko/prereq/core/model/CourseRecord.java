package io.github.cyfko.prereq.core.model;

import java.util.Objects;

/**
 * A student's record for one course.
 *
 * @param status enrollment status
 * @param grade  recorded grade, {@code null} while none has been posted
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CourseRecord(EnrollmentStatus status, Grade grade) {

    public CourseRecord {
        Objects.requireNonNull(status, "status is required");
    }
}
