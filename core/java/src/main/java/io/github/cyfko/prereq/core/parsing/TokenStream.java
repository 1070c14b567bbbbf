package io.github.cyfko.prereq.core.parsing;

import io.github.cyfko.prereq.core.exception.LexError;

import java.util.List;

/**
 * Output of the lexer: the tokens that could be formed plus every error met on the way.
 * <p>
 * The stream also keeps a read cursor used by the parser. It is not thread-safe; each parse works
 * on its own stream.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TokenStream {

    private final String source;
    private final List<Token> tokens;
    private final List<LexError> errors;
    private int position;

    TokenStream(String source, List<Token> tokens, List<LexError> errors) {
        this.source = source;
        this.tokens = List.copyOf(tokens);
        this.errors = List.copyOf(errors);
    }

    public String source() {
        return source;
    }

    public List<Token> tokens() {
        return tokens;
    }

    public List<LexError> errors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    boolean hasNext() {
        return position < tokens.size();
    }

    /**
     * @return the next token without consuming it, or {@code null} at end of input
     */
    Token peek() {
        return hasNext() ? tokens.get(position) : null;
    }

    boolean peekIs(TokenKind kind) {
        Token next = peek();
        return next != null && next.kind() == kind;
    }

    Token next() {
        return tokens.get(position++);
    }
}
