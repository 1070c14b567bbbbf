package io.github.cyfko.prereq.core.model;

/**
 * Where a course stands in a student's history.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum EnrollmentStatus {
    COMPLETED,
    IN_PROGRESS,
    PLANNED
}
