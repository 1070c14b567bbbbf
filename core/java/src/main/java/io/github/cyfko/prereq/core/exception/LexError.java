package io.github.cyfko.prereq.core.exception;

/**
 * A span of catalog text the lexer could not classify.
 *
 * @param text   the offending substring
 * @param offset zero-based offset of {@code text} in the raw input
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record LexError(String text, int offset) {

    @Override
    public String toString() {
        return "'" + text + "' at offset " + offset;
    }
}
