package io.github.cyfko.prereq.core.batch;

import io.github.cyfko.prereq.core.api.ParseOutcome;
import io.github.cyfko.prereq.core.api.PrerequisiteCompiler;
import io.github.cyfko.prereq.core.exception.PrerequisiteException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * Compiles the prerequisites of every course of a crawled term.
 * <p>
 * Courses are independent, so the work is fanned out over a worker pool and fanned back in, in
 * input order. Each course goes through {@link PrerequisiteCompiler#tryParse(String)}: a malformed
 * catalog entry degrades to "prerequisites unknown" for that one course and never aborts the batch.
 * </p>
 *
 * <pre>{@code
 * PrerequisiteBatchParser batch = new PrerequisiteBatchParser(new BasicPrerequisiteCompiler(), 8);
 * BatchParseReport report = batch.parseAll("202508", rawTextByCourse);
 * report.catalog();    // courses with known prerequisites
 * report.failures();   // courses to display as "consult the catalog"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PrerequisiteBatchParser {

    private static final Logger log = Logger.getLogger(PrerequisiteBatchParser.class.getName());

    private final PrerequisiteCompiler compiler;
    private final int parallelism;

    public PrerequisiteBatchParser(PrerequisiteCompiler compiler) {
        this(compiler, Runtime.getRuntime().availableProcessors());
    }

    /**
     * @param compiler    the compiler shared by all workers
     * @param parallelism maximum number of worker threads; {@code 1} parses on the calling thread
     */
    public PrerequisiteBatchParser(PrerequisiteCompiler compiler, int parallelism) {
        this.compiler = Objects.requireNonNull(compiler, "Compiler is required");
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive, got: " + parallelism);
        }
        this.parallelism = parallelism;
    }

    /**
     * Parses a term on a private worker pool sized {@code min(parallelism, courses)}.
     *
     * @param term         the catalog term
     * @param rawByCourse  raw prerequisite text keyed by course id
     * @return one record per course, in the map's iteration order
     * @throws CancellationException if the calling thread is interrupted while waiting
     */
    public BatchParseReport parseAll(String term, Map<String, String> rawByCourse) {
        Objects.requireNonNull(rawByCourse, "Raw prerequisite texts are required");

        int workers = Math.min(parallelism, rawByCourse.size());
        if (workers <= 1) {
            long start = System.nanoTime();
            List<CourseParseRecord> records = new ArrayList<>(rawByCourse.size());
            rawByCourse.forEach((courseId, text) -> records.add(parseOne(term, courseId, text)));
            return report(term, records, start);
        }

        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            return parseAll(term, rawByCourse, pool);
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Parses a term on a caller-owned executor, which is left running.
     *
     * @param term        the catalog term
     * @param rawByCourse raw prerequisite text keyed by course id
     * @param executor    the executor running the per-course tasks
     * @return one record per course, in the map's iteration order
     * @throws CancellationException if the calling thread is interrupted while waiting
     */
    public BatchParseReport parseAll(String term, Map<String, String> rawByCourse, ExecutorService executor) {
        Objects.requireNonNull(rawByCourse, "Raw prerequisite texts are required");
        Objects.requireNonNull(executor, "Executor is required");

        long start = System.nanoTime();
        List<String> courseIds = new ArrayList<>(rawByCourse.keySet());
        List<Future<CourseParseRecord>> futures = new ArrayList<>(courseIds.size());
        for (String courseId : courseIds) {
            String text = rawByCourse.get(courseId);
            futures.add(executor.submit(() -> parseOne(term, courseId, text)));
        }

        List<CourseParseRecord> records = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            records.add(await(term, courseIds.get(i), futures.get(i)));
        }
        return report(term, records, start);
    }

    private CourseParseRecord await(String term, String courseId, Future<CourseParseRecord> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Prerequisite batch for term " + term + " interrupted");
            cancelled.initCause(e);
            throw cancelled;
        } catch (ExecutionException e) {
            // tryParse does not throw; only an Error escaping the worker lands here
            return record(term, courseId, ParseOutcome.failed(
                    new PrerequisiteException("Worker failed while compiling prerequisites", e.getCause())));
        }
    }

    private CourseParseRecord parseOne(String term, String courseId, String text) {
        return record(term, courseId, compiler.tryParse(text));
    }

    private static CourseParseRecord record(String term, String courseId, ParseOutcome outcome) {
        outcome.error().ifPresent(error -> log.warning(() -> String.format(
                "Prerequisites unknown for %s (term %s): %s", courseId, term, error.getMessage())));
        return new CourseParseRecord(term, courseId, outcome);
    }

    private static BatchParseReport report(String term, List<CourseParseRecord> records, long startNanos) {
        BatchParseReport report = new BatchParseReport(term, records, Duration.ofNanos(System.nanoTime() - startNanos));
        log.info(() -> String.format("Compiled prerequisites for term %s: %d course(s), %d unknown, in %d ms",
                term, records.size(), report.failed(), report.elapsed().toMillis()));
        return report;
    }
}
