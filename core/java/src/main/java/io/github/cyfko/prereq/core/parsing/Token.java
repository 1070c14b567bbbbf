package io.github.cyfko.prereq.core.parsing;

/**
 * A classified span of raw prerequisite text.
 *
 * @param kind   the token category
 * @param text   the raw span as it appears in the catalog
 * @param offset zero-based offset of the span in the raw text
 * @param value  normalized payload: course id for {@link TokenKind#COURSE}, grade symbol for
 *               {@link TokenKind#GRADE}, {@code null} otherwise
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenKind kind, String text, int offset, String value) {

    static Token of(TokenKind kind, String text, int offset) {
        return new Token(kind, text, offset, null);
    }

    @Override
    public String toString() {
        return kind + "('" + text + "'@" + offset + ")";
    }
}
