package io.github.cyfko.prereq.spring.service;

import io.github.cyfko.prereq.core.api.ParseOutcome;
import io.github.cyfko.prereq.core.batch.BatchParseReport;
import io.github.cyfko.prereq.core.eval.CourseEligibility;
import io.github.cyfko.prereq.core.model.Prerequisites;
import io.github.cyfko.prereq.core.model.StudentRecord;
import io.github.cyfko.prereq.jpa.CoursePrerequisites;

import java.util.List;
import java.util.Map;

/**
 * Entry point of the prerequisite engine for Spring Boot applications.
 * <p>
 * Serves the two consumers of compiled prerequisites: the catalog crawl, which compiles whole terms and
 * stores the result, and the degree-planning validator, which checks a student's eligibility.
 * </p>
 *
 * <h2>Usage Context</h2>
 * <ul>
 *   <li>Crawl jobs call {@link #crawl(String, Map)} and persist {@link #toStorable(BatchParseReport, Map)}</li>
 *   <li>Planning requests call {@link #checkEligibility(String, CoursePrerequisites, StudentRecord)}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface PrerequisiteService {

    /**
     * @throws io.github.cyfko.prereq.core.exception.PrerequisiteException on malformed text
     */
    Prerequisites parse(String rawText);

    ParseOutcome tryParse(String rawText);

    BatchParseReport crawl(String term, Map<String, String> rawByCourse);

    /**
     * @return one storable value per crawled course, keyed by course id in crawl order
     */
    Map<String, CoursePrerequisites> toStorable(BatchParseReport report, Map<String, String> rawByCourse);

    CourseEligibility checkEligibility(String courseId, ParseOutcome prerequisites, StudentRecord record);

    CourseEligibility checkEligibility(String courseId, CoursePrerequisites prerequisites, StudentRecord record);

    /**
     * @return every catalog course mapped to its verdict, in catalog order
     */
    Map<String, CourseEligibility> checkPlan(Map<String, ParseOutcome> catalog, StudentRecord record);

    List<String> eligibleCourses(Map<String, ParseOutcome> catalog, StudentRecord record);
}
