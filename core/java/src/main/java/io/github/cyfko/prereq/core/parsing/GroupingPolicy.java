package io.github.cyfko.prereq.core.parsing;

import io.github.cyfko.prereq.core.model.Operator;

import java.util.List;

/**
 * Decides how a run of operands joined by connectives, with no parentheses between them, is grouped.
 * <p>
 * Catalog text mixes AND and OR without parentheses and publishes no precedence rule. The default,
 * {@link #LEFT_TO_RIGHT}, groups strictly in textual order and infers no precedence:
 * {@code A and B or C} becomes {@code (A and B) or C} and {@code A or B and C} becomes
 * {@code (A or B) and C}. This is a policy choice, not a verified catalog semantic, so it is kept
 * behind this interface: {@link #AND_BINDS_TIGHTER} is available, and any other strategy can be plugged
 * in through {@link io.github.cyfko.prereq.core.config.ParserPolicy}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface GroupingPolicy {

    GroupingPolicy LEFT_TO_RIGHT = StandardGroupingPolicy.LEFT_TO_RIGHT;

    GroupingPolicy AND_BINDS_TIGHTER = StandardGroupingPolicy.AND_BINDS_TIGHTER;

    /**
     * Groups a connective run.
     *
     * @param operands    the operands in textual order, at least one
     * @param connectives the connectives between them; {@code connectives.size() == operands.size() - 1}
     * @return the grouped tree
     */
    ParseNode group(List<ParseNode> operands, List<Operator> connectives);

    /**
     * Resolves a built-in policy from its name, ignoring case and treating {@code -} as {@code _}.
     *
     * @param name e.g. {@code "left-to-right"} or {@code "AND_BINDS_TIGHTER"}
     * @return the policy
     * @throws IllegalArgumentException if no built-in policy has that name
     */
    static GroupingPolicy named(String name) {
        return StandardGroupingPolicy.fromName(name);
    }
}
