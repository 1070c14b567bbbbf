package io.github.cyfko.prereq.core.config;

import io.github.cyfko.prereq.core.parsing.GroupingPolicy;

/**
 * Limits and behaviour switches applied while compiling catalog prerequisite text.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxInputLength</strong>: Maximum character length of the trimmed text (default: 5000)</li>
 *   <li><strong>maxNestingDepth</strong>: Maximum parenthesis nesting, and maximum set nesting of the
 *       normalized tree (default: 10)</li>
 *   <li><strong>tolerateLexErrors</strong>: Parse the tokens that could be formed even when some spans
 *       were not recognized (default: false)</li>
 *   <li><strong>groupingPolicy</strong>: How un-parenthesized mixed AND/OR runs are grouped
 *       (default: {@link GroupingPolicy#LEFT_TO_RIGHT})</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (catalog crawl)
 * ParserPolicy policy = ParserPolicy.defaults();
 *
 * // Strict (text typed by users in admin tooling)
 * ParserPolicy policy = ParserPolicy.strict();
 *
 * // Relaxed (salvage as much as possible from noisy catalogs)
 * ParserPolicy policy = ParserPolicy.relaxed();
 *
 * // Custom
 * ParserPolicy policy = ParserPolicy.builder()
 *     .groupingPolicy(GroupingPolicy.AND_BINDS_TIGHTER)
 *     .build();
 * }</pre>
 *
 * @param policyName        name reported in error messages
 * @param maxInputLength    maximum character length of the trimmed input
 * @param maxNestingDepth   maximum parenthesis nesting depth, also applied to the normalized set nesting
 * @param tolerateLexErrors whether unrecognized spans are skipped instead of failing
 * @param groupingPolicy    grouping strategy for un-parenthesized connective runs
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParserPolicy(
        String policyName,
        int maxInputLength,
        int maxNestingDepth,
        boolean tolerateLexErrors,
        GroupingPolicy groupingPolicy
) {

    public static final int DEFAULT_MAX_DEPTH = 10;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public ParserPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxInputLength <= 0) {
            throw new IllegalArgumentException("maxInputLength must be positive, got: " + maxInputLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        if (groupingPolicy == null) {
            throw new IllegalArgumentException("groupingPolicy is required");
        }
    }

    /**
     * Default configuration used by the catalog crawl.
     * <ul>
     *   <li>Max Input Length: 5000 characters</li>
     *   <li>Max Nesting Depth: 10</li>
     *   <li>Lex errors: fatal</li>
     *   <li>Grouping: left-to-right</li>
     * </ul>
     *
     * @return default configuration
     */
    public static ParserPolicy defaults() {
        return new ParserPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, DEFAULT_MAX_DEPTH, false, GroupingPolicy.LEFT_TO_RIGHT);
    }

    /**
     * Strict configuration for hand-entered text.
     * <ul>
     *   <li>Max Input Length: 1000 characters</li>
     *   <li>Max Nesting Depth: 5</li>
     *   <li>Lex errors: fatal</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static ParserPolicy strict() {
        return new ParserPolicy(PolicyName.STRICT_POLICY.name(), 1000, 5, false, GroupingPolicy.LEFT_TO_RIGHT);
    }

    /**
     * Relaxed configuration that keeps whatever tokens could be formed.
     * <ul>
     *   <li>Max Input Length: 10000 characters</li>
     *   <li>Max Nesting Depth: 10</li>
     *   <li>Lex errors: tolerated</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static ParserPolicy relaxed() {
        return new ParserPolicy(PolicyName.RELAXED_POLICY.name(), 10000, DEFAULT_MAX_DEPTH, true, GroupingPolicy.LEFT_TO_RIGHT);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxInputLength = 5000;
        private int _maxNestingDepth = DEFAULT_MAX_DEPTH;
        private boolean _tolerateLexErrors = false;
        private GroupingPolicy _groupingPolicy = GroupingPolicy.LEFT_TO_RIGHT;

        private Builder() {}

        public ParserPolicy build() {
            return new ParserPolicy(_policyName, _maxInputLength, _maxNestingDepth, _tolerateLexErrors, _groupingPolicy);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxInputLength(int maxInputLength) { this._maxInputLength = maxInputLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
        public Builder tolerateLexErrors(boolean tolerate) { this._tolerateLexErrors = tolerate; return this; }
        public Builder groupingPolicy(GroupingPolicy groupingPolicy) { this._groupingPolicy = groupingPolicy; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
