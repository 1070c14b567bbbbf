package io.github.cyfko.prereq.core.model;

import java.util.Optional;

/**
 * Read-only view of a student's course history, owned by the caller.
 * <p>
 * Implementations are expected to match course ids case-insensitively.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface StudentRecord {

    /**
     * @param courseId normalized course id, e.g. {@code "CS 1331"}
     * @return the student's record for that course, if any
     */
    Optional<CourseRecord> lookup(String courseId);

    /**
     * @return a record with no courses at all
     */
    static StudentRecord empty() {
        return courseId -> Optional.empty();
    }
}
