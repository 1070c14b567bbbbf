package io.github.cyfko.prereq.core.parsing;

import io.github.cyfko.prereq.core.exception.LexError;
import io.github.cyfko.prereq.core.model.Grade;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizes free-form catalog prerequisite text.
 * <p>
 * Recognized spans, tried in this order at every position:
 * </p>
 * <ul>
 *   <li>Level modifiers ({@code Undergraduate Semester level}, {@code Graduate level}, ...): discarded</li>
 *   <li>Grade clause: {@code Minimum Grade of C}</li>
 *   <li>Concurrency marker: {@code [may be taken concurrently]}, {@code may be taken concurrently},
 *       {@code (concurrent)}</li>
 *   <li>Connectives: {@code and}, {@code or}, and {@code ,} as an implicit AND</li>
 *   <li>Course code: 2 to 4 letters, optional whitespace, 4 digits, optional trailing letter</li>
 *   <li>Parentheses</li>
 * </ul>
 * <p>
 * Anything else becomes a {@link LexError} spanning up to the next whitespace or delimiter. Lexing
 * continues after an error so the caller receives every problem at once together with the tokens
 * that could still be formed.
 * </p>
 *
 * <pre>{@code
 * TokenStream ts = PrerequisiteLexer.tokenize("Undergraduate Semester level CS 1331 Minimum Grade of C or CS 1301");
 * // COURSE(CS 1331) GRADE(C) OR COURSE(CS 1301)
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PrerequisiteLexer {

    private static final Pattern MODIFIER = Pattern.compile(
            "(?i)(?:under)?graduate\\s+(?:(?:semester|quarter)\\s+)?level(?![A-Za-z0-9])");
    private static final Pattern GRADE_CLAUSE = Pattern.compile(
            "(?i)minimum\\s+grade\\s+of\\s+([A-Za-z])(?![A-Za-z0-9])");
    private static final Pattern CONCURRENCY = Pattern.compile(
            "(?i)\\[\\s*may\\s+be\\s+taken\\s+concurrently\\s*]|may\\s+be\\s+taken\\s+concurrently(?![A-Za-z0-9])|\\(\\s*concurrent\\s*\\)");
    private static final Pattern CONNECTIVE = Pattern.compile("(?i)(and|or)(?![A-Za-z0-9])");
    private static final Pattern COURSE_CODE = Pattern.compile(
            "([A-Za-z]{2,4})\\s*(\\d{4}[A-Za-z]?)(?![A-Za-z0-9])");

    private PrerequisiteLexer() {}

    /**
     * Splits raw text into tokens.
     *
     * @param rawText catalog text, may be {@code null} (treated as empty)
     * @return the token stream, carrying any lexing errors
     */
    public static TokenStream tokenize(String rawText) {
        String text = rawText == null ? "" : rawText;
        List<Token> tokens = new ArrayList<>();
        List<LexError> errors = new ArrayList<>();

        Matcher modifier = MODIFIER.matcher(text);
        Matcher grade = GRADE_CLAUSE.matcher(text);
        Matcher concurrency = CONCURRENCY.matcher(text);
        Matcher connective = CONNECTIVE.matcher(text);
        Matcher course = COURSE_CODE.matcher(text);

        int i = 0;
        int length = text.length();
        while (i < length) {
            char c = text.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if (lookingAt(modifier, i, length)) {
                i = modifier.end();
                continue;
            }

            if (lookingAt(concurrency, i, length)) {
                tokens.add(Token.of(TokenKind.CONCURRENT, concurrency.group(), i));
                i = concurrency.end();
                continue;
            }

            if (c == '(' || c == ')') {
                tokens.add(Token.of(c == '(' ? TokenKind.LPAREN : TokenKind.RPAREN, String.valueOf(c), i));
                i++;
                continue;
            }

            if (c == ',') {
                tokens.add(Token.of(TokenKind.AND, ",", i));
                i++;
                continue;
            }

            if (lookingAt(grade, i, length)) {
                String symbol = grade.group(1).toUpperCase(Locale.ROOT);
                if (Grade.lookup(symbol).isPresent()) {
                    tokens.add(new Token(TokenKind.GRADE, grade.group(), i, symbol));
                } else {
                    errors.add(new LexError(grade.group(), i));
                }
                i = grade.end();
                continue;
            }

            if (lookingAt(connective, i, length)) {
                TokenKind kind = connective.group(1).equalsIgnoreCase("and") ? TokenKind.AND : TokenKind.OR;
                tokens.add(Token.of(kind, connective.group(), i));
                i = connective.end();
                continue;
            }

            if (lookingAt(course, i, length)) {
                String id = course.group(1).toUpperCase(Locale.ROOT) + " " + course.group(2).toUpperCase(Locale.ROOT);
                tokens.add(new Token(TokenKind.COURSE, course.group(), i, id));
                i = course.end();
                continue;
            }

            int end = errorSpanEnd(text, i);
            errors.add(new LexError(text.substring(i, end), i));
            i = end;
        }

        return new TokenStream(text, tokens, errors);
    }

    private static boolean lookingAt(Matcher matcher, int from, int to) {
        matcher.region(from, to);
        return matcher.lookingAt();
    }

    private static int errorSpanEnd(String text, int start) {
        int end = start + 1;
        while (end < text.length()) {
            char c = text.charAt(end);
            if (Character.isWhitespace(c) || c == '(' || c == ')' || c == ',' || c == '[') {
                break;
            }
            end++;
        }
        return end;
    }
}
