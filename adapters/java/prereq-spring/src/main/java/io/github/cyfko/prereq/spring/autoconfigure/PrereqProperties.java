package io.github.cyfko.prereq.spring.autoconfigure;

import io.github.cyfko.prereq.core.config.CachePolicy;
import io.github.cyfko.prereq.core.config.EvaluationPolicy;
import io.github.cyfko.prereq.core.config.ParserPolicy;
import io.github.cyfko.prereq.core.parsing.GroupingPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from {@code prereq.*}.
 *
 * <pre>
 * prereq.parser.grouping=left-to-right
 * prereq.parser.max-nesting-depth=10
 * prereq.parser.tolerate-lex-errors=false
 * prereq.evaluation.count-planned-as-pending=true
 * prereq.cache.size=5000
 * prereq.batch.parallelism=8
 * </pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "prereq")
public class PrereqProperties {
    private Parser parser = new Parser();
    private Evaluation evaluation = new Evaluation();
    private Cache cache = new Cache();
    private Batch batch = new Batch();

    public static class Parser {
        private int maxInputLength = 5000;
        private int maxNestingDepth = ParserPolicy.DEFAULT_MAX_DEPTH;
        private boolean tolerateLexErrors = false;
        /** {@code left-to-right} or {@code and-binds-tighter}. */
        private String grouping = "left-to-right";

        public int getMaxInputLength() { return maxInputLength; }
        public void setMaxInputLength(int maxInputLength) { this.maxInputLength = maxInputLength; }
        public int getMaxNestingDepth() { return maxNestingDepth; }
        public void setMaxNestingDepth(int maxNestingDepth) { this.maxNestingDepth = maxNestingDepth; }
        public boolean isTolerateLexErrors() { return tolerateLexErrors; }
        public void setTolerateLexErrors(boolean tolerateLexErrors) { this.tolerateLexErrors = tolerateLexErrors; }
        public String getGrouping() { return grouping; }
        public void setGrouping(String grouping) { this.grouping = grouping; }
    }

    public static class Evaluation {
        private int maxDepth = ParserPolicy.DEFAULT_MAX_DEPTH;
        private boolean countPlannedAsPending = false;

        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }
        public boolean isCountPlannedAsPending() { return countPlannedAsPending; }
        public void setCountPlannedAsPending(boolean countPlannedAsPending) { this.countPlannedAsPending = countPlannedAsPending; }
    }

    public static class Cache {
        private boolean enabled = true;
        private int size = 1000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getSize() { return size; }
        public void setSize(int size) { this.size = size; }
    }

    public static class Batch {
        /** Worker threads for a crawl; 0 means one per available processor. */
        private int parallelism = 0;

        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }
    }

    public ParserPolicy toParserPolicy() {
        return ParserPolicy.builder()
                .policyName("SPRING_PROPERTIES")
                .maxInputLength(parser.maxInputLength)
                .maxNestingDepth(parser.maxNestingDepth)
                .tolerateLexErrors(parser.tolerateLexErrors)
                .groupingPolicy(GroupingPolicy.named(parser.grouping))
                .build();
    }

    public EvaluationPolicy toEvaluationPolicy() {
        return new EvaluationPolicy(evaluation.maxDepth, evaluation.countPlannedAsPending);
    }

    public CachePolicy toCachePolicy() {
        return cache.enabled ? CachePolicy.custom(cache.size) : CachePolicy.none();
    }

    public int effectiveParallelism() {
        return batch.parallelism > 0 ? batch.parallelism : Runtime.getRuntime().availableProcessors();
    }

    public Parser getParser() { return parser; }
    public void setParser(Parser parser) { this.parser = parser; }
    public Evaluation getEvaluation() { return evaluation; }
    public void setEvaluation(Evaluation evaluation) { this.evaluation = evaluation; }
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }
    public Batch getBatch() { return batch; }
    public void setBatch(Batch batch) { this.batch = batch; }
}
