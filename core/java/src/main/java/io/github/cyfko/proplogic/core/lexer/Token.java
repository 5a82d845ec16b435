package io.github.cyfko.proplogic.core.lexer;

import java.util.Objects;

/**
 * Immutable lexical unit produced by the {@link Lexer}.
 *
 * @param kind     the token classification
 * @param text     the matched source text; for {@link TokenKind#IDENT} the identifier name,
 *                 empty for {@link TokenKind#EOF}
 * @param position where the token starts in the source
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenKind kind, String text, SourcePosition position) {

    public Token {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(position, "position cannot be null");
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    /**
     * Describes this token for diagnostics: identifiers by name, every other kind by its symbol.
     *
     * @return a short description such as {@code identifier 'p'} or {@code ')'}
     */
    public String describe() {
        return kind == TokenKind.IDENT
                ? "identifier '" + text + "'"
                : kind.description();
    }

    @Override
    public String toString() {
        return String.format("Token[kind=%s, text='%s', at %s]", kind, text, position);
    }
}
