package io.github.cyfko.prereq.core.parsing;

import io.github.cyfko.prereq.core.exception.DepthExceededException;
import io.github.cyfko.prereq.core.exception.ParseException;
import io.github.cyfko.prereq.core.model.Course;
import io.github.cyfko.prereq.core.model.Grade;
import io.github.cyfko.prereq.core.model.Operator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recursive-descent parser over a {@link TokenStream}.
 *
 * <h2>Grammar</h2>
 * <pre>
 * expression   := term (connective term)*
 * term         := '(' expression ')' | courseClause
 * courseClause := COURSE (GRADE | CONCURRENT)*
 * connective   := AND | OR
 * </pre>
 * <p>
 * Parenthesized groups always take precedence. Each connective run at one nesting level is handed to
 * the {@link GroupingPolicy}. A grade clause binds only to the course immediately before it; after a
 * closing parenthesis it is an error.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PrerequisiteParser {

    private final GroupingPolicy groupingPolicy;
    private final int maxNestingDepth;

    /**
     * @param groupingPolicy  strategy for un-parenthesized connective runs
     * @param maxNestingDepth maximum parenthesis nesting
     */
    public PrerequisiteParser(GroupingPolicy groupingPolicy, int maxNestingDepth) {
        this.groupingPolicy = Objects.requireNonNull(groupingPolicy, "Grouping policy is required");
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Parses the whole stream. Lexing errors carried by the stream are ignored here; deciding whether
     * a partial token stream is acceptable belongs to the caller.
     *
     * @param tokens a fresh token stream
     * @return the raw parse tree
     * @throws ParseException         on any grammar violation, including an empty stream
     * @throws DepthExceededException if parentheses nest deeper than allowed
     */
    public ParseNode parse(TokenStream tokens) {
        ParseNode root = expression(tokens, 0);
        if (tokens.hasNext()) {
            Token extra = tokens.peek();
            if (extra.kind() == TokenKind.RPAREN) {
                throw new ParseException("Unmatched ')'", extra.offset(), extra.text());
            }
            throw new ParseException("Expected 'and', 'or' or ',' before " + describe(extra), extra.offset(), extra.text());
        }
        return root;
    }

    private ParseNode expression(TokenStream tokens, int depth) {
        List<ParseNode> operands = new ArrayList<>();
        List<Operator> connectives = new ArrayList<>();

        operands.add(term(tokens, depth));
        while (tokens.hasNext() && tokens.peek().kind().isConnective()) {
            Token connective = tokens.next();
            if (!tokens.hasNext() || tokens.peekIs(TokenKind.RPAREN)) {
                throw new ParseException("Dangling connective '" + connective.text() + "'", connective.offset(), connective.text());
            }
            connectives.add(connective.kind() == TokenKind.AND ? Operator.AND : Operator.OR);
            operands.add(term(tokens, depth));
        }

        return operands.size() == 1 ? operands.get(0) : groupingPolicy.group(operands, connectives);
    }

    private ParseNode term(TokenStream tokens, int depth) {
        Token token = tokens.peek();
        if (token == null) {
            throw new ParseException("Expected a course or '(' but reached end of input");
        }

        return switch (token.kind()) {
            case LPAREN -> group(tokens, depth);
            case COURSE -> courseClause(tokens);
            case GRADE, CONCURRENT -> throw new ParseException(
                    "Grade or concurrency clause must directly follow a course", token.offset(), token.text());
            default -> throw new ParseException(
                    "Expected a course or '(' but found " + describe(token), token.offset(), token.text());
        };
    }

    private ParseNode group(TokenStream tokens, int depth) {
        Token open = tokens.next();
        if (depth + 1 > maxNestingDepth) {
            throw new DepthExceededException(maxNestingDepth);
        }
        if (!tokens.hasNext()) {
            throw new ParseException("Unmatched '('", open.offset(), open.text());
        }
        if (tokens.peekIs(TokenKind.RPAREN)) {
            throw new ParseException("Empty parenthesized group", open.offset(), open.text());
        }

        ParseNode inner = expression(tokens, depth + 1);

        if (!tokens.peekIs(TokenKind.RPAREN)) {
            throw new ParseException("Unmatched '('", open.offset(), open.text());
        }
        tokens.next();

        Token trailing = tokens.peek();
        if (trailing != null && trailing.kind().isCourseModifier()) {
            throw new ParseException("Grade or concurrency clause cannot apply to a group", trailing.offset(), trailing.text());
        }
        return inner;
    }

    private ParseNode courseClause(TokenStream tokens) {
        Token code = tokens.next();
        Grade grade = null;
        boolean concurrent = false;

        while (tokens.hasNext() && tokens.peek().kind().isCourseModifier()) {
            Token modifier = tokens.next();
            if (modifier.kind() == TokenKind.GRADE) {
                if (grade != null) {
                    throw new ParseException("Course " + code.value() + " already has a minimum grade", modifier.offset(), modifier.text());
                }
                grade = Grade.fromSymbol(modifier.value());
            } else {
                concurrent = true;
            }
        }

        return new ParseNode.CourseNode(new Course(code.value(), grade, concurrent), code.offset());
    }

    private static String describe(Token token) {
        return switch (token.kind()) {
            case COURSE -> "course " + token.value();
            case AND, OR -> "connective '" + token.text() + "'";
            default -> "'" + token.text() + "'";
        };
    }
}
