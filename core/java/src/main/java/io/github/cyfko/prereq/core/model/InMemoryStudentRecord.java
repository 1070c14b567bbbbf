package io.github.cyfko.prereq.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Map-backed {@link StudentRecord}.
 *
 * <pre>{@code
 * StudentRecord record = InMemoryStudentRecord.builder()
 *     .completed("CS 1331", Grade.B)
 *     .inProgress("MATH 1554")
 *     .planned("CS 2340")
 *     .build();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class InMemoryStudentRecord implements StudentRecord {

    private final Map<String, CourseRecord> records;

    private InMemoryStudentRecord(Map<String, CourseRecord> records) {
        this.records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
    }

    @Override
    public Optional<CourseRecord> lookup(String courseId) {
        if (courseId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(key(courseId)));
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String key(String courseId) {
        return courseId.trim().toUpperCase(Locale.ROOT);
    }

    public static class Builder {
        private final Map<String, CourseRecord> records = new LinkedHashMap<>();

        private Builder() {}

        public Builder completed(String courseId, Grade grade) {
            return put(courseId, new CourseRecord(EnrollmentStatus.COMPLETED, grade));
        }

        /**
         * @throws io.github.cyfko.prereq.core.exception.GradeComparisonException if the grade is off the scale
         */
        public Builder completed(String courseId, String grade) {
            return completed(courseId, grade == null ? null : Grade.fromSymbol(grade));
        }

        public Builder inProgress(String courseId) {
            return put(courseId, new CourseRecord(EnrollmentStatus.IN_PROGRESS, null));
        }

        public Builder inProgress(String courseId, Grade grade) {
            return put(courseId, new CourseRecord(EnrollmentStatus.IN_PROGRESS, grade));
        }

        public Builder planned(String courseId) {
            return put(courseId, new CourseRecord(EnrollmentStatus.PLANNED, null));
        }

        public Builder put(String courseId, CourseRecord record) {
            if (courseId == null || courseId.isBlank()) {
                throw new IllegalArgumentException("Course id is required");
            }
            records.put(key(courseId), record);
            return this;
        }

        public InMemoryStudentRecord build() {
            return new InMemoryStudentRecord(records);
        }
    }
}
