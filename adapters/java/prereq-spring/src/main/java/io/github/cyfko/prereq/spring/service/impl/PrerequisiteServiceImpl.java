package io.github.cyfko.prereq.spring.service.impl;

import io.github.cyfko.prereq.core.analysis.PrerequisiteAnalysis;
import io.github.cyfko.prereq.core.api.EligibilityEvaluator;
import io.github.cyfko.prereq.core.api.ParseOutcome;
import io.github.cyfko.prereq.core.api.PrerequisiteCompiler;
import io.github.cyfko.prereq.core.batch.BatchParseReport;
import io.github.cyfko.prereq.core.batch.CourseParseRecord;
import io.github.cyfko.prereq.core.batch.PrerequisiteBatchParser;
import io.github.cyfko.prereq.core.eval.CourseEligibility;
import io.github.cyfko.prereq.core.model.Prerequisites;
import io.github.cyfko.prereq.core.model.StudentRecord;
import io.github.cyfko.prereq.jpa.CoursePrerequisites;
import io.github.cyfko.prereq.spring.service.PrerequisiteService;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

public class PrerequisiteServiceImpl implements PrerequisiteService {

    private static final Logger log = Logger.getLogger(PrerequisiteServiceImpl.class.getName());

    private final PrerequisiteCompiler compiler;
    private final EligibilityEvaluator evaluator;
    private final PrerequisiteBatchParser batchParser;

    public PrerequisiteServiceImpl(PrerequisiteCompiler compiler,
                                   EligibilityEvaluator evaluator,
                                   PrerequisiteBatchParser batchParser) {
        this.compiler = Objects.requireNonNull(compiler, "Compiler is required");
        this.evaluator = Objects.requireNonNull(evaluator, "Evaluator is required");
        this.batchParser = Objects.requireNonNull(batchParser, "Batch parser is required");
    }

    @Override
    public Prerequisites parse(String rawText) {
        return compiler.parse(rawText);
    }

    @Override
    public ParseOutcome tryParse(String rawText) {
        return compiler.tryParse(rawText);
    }

    @Override
    public BatchParseReport crawl(String term, Map<String, String> rawByCourse) {
        return batchParser.parseAll(term, rawByCourse);
    }

    @Override
    public Map<String, CoursePrerequisites> toStorable(BatchParseReport report, Map<String, String> rawByCourse) {
        Map<String, CoursePrerequisites> storable = new LinkedHashMap<>();
        for (CourseParseRecord record : report.records()) {
            storable.put(record.courseId(), CoursePrerequisites.from(record, rawByCourse.get(record.courseId())));
        }
        return storable;
    }

    @Override
    public CourseEligibility checkEligibility(String courseId, ParseOutcome prerequisites, StudentRecord record) {
        CourseEligibility eligibility = prerequisites.value()
                .map(p -> CourseEligibility.of(courseId, evaluator.evaluate(p, record)))
                .orElseGet(() -> CourseEligibility.undetermined(courseId));

        log.fine(() -> String.format("Eligibility for %s: %s (%s)", courseId, eligibility.verdict(), eligibility.message()));
        return eligibility;
    }

    @Override
    public CourseEligibility checkEligibility(String courseId, CoursePrerequisites prerequisites, StudentRecord record) {
        if (prerequisites == null) {
            return CourseEligibility.undetermined(courseId);
        }
        return checkEligibility(courseId, prerequisites.toOutcome(), record);
    }

    @Override
    public Map<String, CourseEligibility> checkPlan(Map<String, ParseOutcome> catalog, StudentRecord record) {
        return PrerequisiteAnalysis.checkAll(catalog, record, evaluator);
    }

    @Override
    public List<String> eligibleCourses(Map<String, ParseOutcome> catalog, StudentRecord record) {
        return PrerequisiteAnalysis.eligibleCourses(catalog, record, evaluator);
    }
}
