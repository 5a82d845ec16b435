package io.github.cyfko.proplogic.core.exception;

import io.github.cyfko.proplogic.core.lexer.SourcePosition;

import java.util.Objects;

/**
 * Exception thrown by the lexer when a character matches no token rule.
 *
 * <pre>{@code
 * new Lexer("1 & 0").tokenize();
 * // → "Lexical error at line 1, column 3: unexpected character '&'"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class LexicalException extends LogicException {

    private final SourcePosition position;
    private final char unexpectedChar;

    public LexicalException(SourcePosition position, char unexpectedChar) {
        super(Stage.LEX, String.format("Lexical error at %s: unexpected character %s",
                Objects.requireNonNull(position, "position cannot be null"), printable(unexpectedChar)));
        this.position = position;
        this.unexpectedChar = unexpectedChar;
    }

    public SourcePosition getPosition() {
        return position;
    }

    public char getUnexpectedChar() {
        return unexpectedChar;
    }

    private static String printable(char c) {
        if (Character.isISOControl(c) || Character.isWhitespace(c)) {
            return String.format("U+%04X", (int) c);
        }
        return "'" + c + "'";
    }
}
