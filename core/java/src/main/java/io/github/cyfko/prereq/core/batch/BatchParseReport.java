package io.github.cyfko.prereq.core.batch;

import io.github.cyfko.prereq.core.api.ParseOutcome;
import io.github.cyfko.prereq.core.model.Prerequisites;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Fan-in result of {@link PrerequisiteBatchParser#parseAll(String, Map)}.
 *
 * @param term    the crawled term
 * @param records one record per input course, in input iteration order
 * @param elapsed wall-clock duration of the batch
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record BatchParseReport(String term, List<CourseParseRecord> records, Duration elapsed) {

    public BatchParseReport {
        records = List.copyOf(records);
    }

    public int succeeded() {
        return (int) records.stream().filter(r -> !r.isUnknown()).count();
    }

    public int failed() {
        return records.size() - succeeded();
    }

    public List<CourseParseRecord> failures() {
        return records.stream().filter(CourseParseRecord::isUnknown).collect(Collectors.toList());
    }

    /**
     * @return every course mapped to its outcome, in input order
     */
    public Map<String, ParseOutcome> outcomes() {
        Map<String, ParseOutcome> outcomes = new LinkedHashMap<>();
        records.forEach(r -> outcomes.put(r.courseId(), r.outcome()));
        return Collections.unmodifiableMap(outcomes);
    }

    /**
     * @return courses with known prerequisites mapped to them, in input order; unknown courses are absent
     */
    public Map<String, Prerequisites> catalog() {
        Map<String, Prerequisites> catalog = new LinkedHashMap<>();
        records.forEach(r -> r.outcome().value().ifPresent(p -> catalog.put(r.courseId(), p)));
        return Collections.unmodifiableMap(catalog);
    }
}
