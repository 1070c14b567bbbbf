package io.github.cyfko.prereq.core.parsing;

import io.github.cyfko.prereq.core.model.Operator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Built-in {@link GroupingPolicy} strategies.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum StandardGroupingPolicy implements GroupingPolicy {

    /** Textual order, no inferred precedence. */
    LEFT_TO_RIGHT {
        @Override
        public ParseNode group(List<ParseNode> operands, List<Operator> connectives) {
            checkShape(operands, connectives);
            return foldLeft(operands, connectives, 0, operands.size());
        }
    },

    /** Conventional boolean precedence: AND runs are grouped first, then joined by OR. */
    AND_BINDS_TIGHTER {
        @Override
        public ParseNode group(List<ParseNode> operands, List<Operator> connectives) {
            checkShape(operands, connectives);
            List<ParseNode> disjuncts = new ArrayList<>();
            int runStart = 0;
            for (int i = 0; i < connectives.size(); i++) {
                if (connectives.get(i) == Operator.OR) {
                    disjuncts.add(foldLeft(operands, connectives, runStart, i + 1));
                    runStart = i + 1;
                }
            }
            disjuncts.add(foldLeft(operands, connectives, runStart, operands.size()));

            ParseNode result = disjuncts.get(0);
            for (int i = 1; i < disjuncts.size(); i++) {
                result = new ParseNode.BinaryNode(Operator.OR, result, disjuncts.get(i));
            }
            return result;
        }
    };

    /**
     * Folds {@code operands[from, to)} left to right using the connectives between them.
     */
    private static ParseNode foldLeft(List<ParseNode> operands, List<Operator> connectives, int from, int to) {
        ParseNode result = operands.get(from);
        for (int i = from + 1; i < to; i++) {
            result = new ParseNode.BinaryNode(connectives.get(i - 1), result, operands.get(i));
        }
        return result;
    }

    private static void checkShape(List<ParseNode> operands, List<Operator> connectives) {
        if (operands.isEmpty() || connectives.size() != operands.size() - 1) {
            throw new IllegalArgumentException(String.format(
                    "Expected n operands and n-1 connectives, got %d and %d", operands.size(), connectives.size()));
        }
    }

    static StandardGroupingPolicy fromName(String name) {
        if (name != null) {
            String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
            for (StandardGroupingPolicy policy : values()) {
                if (policy.name().equals(normalized)) {
                    return policy;
                }
            }
        }
        throw new IllegalArgumentException("Unknown grouping policy: " + name);
    }
}
