package io.github.cyfko.proplogic.core.lexer;

import io.github.cyfko.proplogic.core.exception.LexicalException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Lazy scanner turning statement source into {@link Token}s.
 * <p>
 * Tokens are produced one at a time through the {@link Iterator} contract, so the parser can
 * pull them on demand. The sequence always ends with exactly one {@link TokenKind#EOF} token.
 * </p>
 *
 * <h2>Lexical rules</h2>
 * <ul>
 *   <li>{@code 0} and {@code 1} are the boolean literals; no other digit is accepted</li>
 *   <li>{@code ~ ^ v => <=> := ( )} are the operator and grouping symbols</li>
 *   <li>an identifier is a maximal run of ASCII letters; the run {@code v} alone is the OR operator</li>
 *   <li>spaces, tabs and carriage returns separate tokens and are otherwise ignored</li>
 *   <li>a line feed yields a {@link TokenKind#NEWLINE}; consecutive blank lines collapse into one</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Lexer lexer = new Lexer("p := 1\n~p v 0");
 * while (lexer.hasNext()) {
 *     Token token = lexer.next();
 * }
 *
 * // or all at once
 * List<Token> tokens = new Lexer("1 ^ 0").tokenize();
 * }</pre>
 *
 * <p>
 * A lexer is single use. Restarting means creating a new instance over the same text.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class Lexer implements Iterator<Token> {

    private final String source;
    private int offset = 0;
    private int line = 1;
    private int column = 1;
    private boolean eofEmitted = false;

    public Lexer(String source) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
    }

    /**
     * Drains the remaining tokens into a list, {@link TokenKind#EOF} included.
     *
     * @return the remaining tokens in source order
     * @throws LexicalException if a character matches no token rule
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (hasNext()) {
            tokens.add(next());
        }
        return tokens;
    }

    @Override
    public boolean hasNext() {
        return !eofEmitted;
    }

    /**
     * Scans the next token.
     *
     * @return the next token
     * @throws LexicalException if a character matches no token rule
     * @throws NoSuchElementException if {@link TokenKind#EOF} was already returned
     */
    @Override
    public Token next() {
        if (eofEmitted) {
            throw new NoSuchElementException("Lexer already reached end of input");
        }

        skipBlanks();

        if (isAtEnd()) {
            eofEmitted = true;
            return new Token(TokenKind.EOF, "", position());
        }

        SourcePosition start = position();
        char c = peek();

        if (c == '\n') {
            skipLineBreaks();
            return new Token(TokenKind.NEWLINE, "\n", start);
        }

        if (isLetter(c)) {
            return readIdentifierOrOr(start);
        }

        return switch (c) {
            case '0' -> single(TokenKind.LITERAL_0, start);
            case '1' -> single(TokenKind.LITERAL_1, start);
            case '~' -> single(TokenKind.NOT, start);
            case '^' -> single(TokenKind.AND, start);
            case '(' -> single(TokenKind.LPAREN, start);
            case ')' -> single(TokenKind.RPAREN, start);
            case ':' -> symbol(TokenKind.ASSIGN, ":=", start);
            case '=' -> symbol(TokenKind.IMPLIES, "=>", start);
            case '<' -> symbol(TokenKind.IFF, "<=>", start);
            default -> throw new LexicalException(start, c);
        };
    }

    private Token readIdentifierOrOr(SourcePosition start) {
        int begin = offset;
        while (!isAtEnd() && isLetter(peek())) {
            advance();
        }
        String text = source.substring(begin, offset);
        TokenKind kind = "v".equals(text) ? TokenKind.OR : TokenKind.IDENT;
        return new Token(kind, text, start);
    }

    private Token single(TokenKind kind, SourcePosition start) {
        String text = String.valueOf(peek());
        advance();
        return new Token(kind, text, start);
    }

    /**
     * Matches a multi-character symbol. On mismatch the offending character is reported; when the
     * source ends inside the symbol, its leading character is reported instead.
     */
    private Token symbol(TokenKind kind, String symbol, SourcePosition start) {
        for (int i = 0; i < symbol.length(); i++) {
            if (isAtEnd()) {
                throw new LexicalException(start, symbol.charAt(0));
            }
            if (peek() != symbol.charAt(i)) {
                throw new LexicalException(position(), peek());
            }
            advance();
        }
        return new Token(kind, symbol, start);
    }

    private void skipBlanks() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r') {
                advance();
            } else {
                break;
            }
        }
    }

    private void skipLineBreaks() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\n' || c == ' ' || c == '\t' || c == '\r') {
                advance();
            } else {
                break;
            }
        }
    }

    private SourcePosition position() {
        return new SourcePosition(offset, line, column);
    }

    private boolean isAtEnd() {
        return offset >= source.length();
    }

    private char peek() {
        return source.charAt(offset);
    }

    private void advance() {
        if (source.charAt(offset) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        offset++;
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
