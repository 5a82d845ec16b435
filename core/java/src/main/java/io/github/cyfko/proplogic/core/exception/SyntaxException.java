package io.github.cyfko.proplogic.core.exception;

import io.github.cyfko.proplogic.core.config.LogicPolicy;
import io.github.cyfko.proplogic.core.lexer.SourcePosition;
import io.github.cyfko.proplogic.core.lexer.Token;

import java.util.Objects;
import java.util.Optional;

/**
 * Exception thrown when a statement does not follow the grammar or breaks a parsing rule.
 * <p>
 * The {@link Kind} tells which rule was broken. Depending on the kind, the exception also
 * carries what the parser expected, the token it found instead, and the offending variable name.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * // 1. Missing closing parenthesis
 * interpreter.parse("(1 v 0");
 * // → "Syntax error at line 1, column 7: expected ')' but found end of input"
 *
 * // 2. Only assignments, no expression
 * interpreter.parse("p := 1\n");
 * // → "Syntax error at line 2, column 1: program has no expression to evaluate"
 *
 * // 3. Rebinding a variable
 * interpreter.parse("p := 1\np := 0\np");
 * // → "Syntax error at line 2, column 1: variable 'p' is already assigned"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class SyntaxException extends LogicException {

    /**
     * The parsing rule that was broken.
     */
    public enum Kind {
        /** A token did not match what the grammar expects at that point. */
        UNEXPECTED_TOKEN,
        /** No expression remains after the assignment lines. */
        EMPTY_PROGRAM,
        /** A variable was assigned twice. */
        DUPLICATE_ASSIGNMENT,
        /** Negations, parentheses or operator chains nest deeper than the policy allows. */
        NESTING_TOO_DEEP,
        /** The source is longer than the policy allows. */
        SOURCE_TOO_LONG
    }

    private final Kind kind;
    private final SourcePosition position;
    private final String expected;
    private final Token found;
    private final String name;

    private SyntaxException(Kind kind, SourcePosition position, String expected, Token found, String name, String detail) {
        super(Stage.PARSE, position == null
                ? "Syntax error: " + detail
                : "Syntax error at " + position + ": " + detail);
        this.kind = kind;
        this.position = position;
        this.expected = expected;
        this.found = found;
        this.name = name;
    }

    /**
     * Creates the error for a token that does not fit the grammar.
     *
     * @param expected what the parser was looking for, e.g. {@code "')'"}
     * @param found    the token actually read; its position is reported
     * @return the exception
     */
    public static SyntaxException unexpectedToken(String expected, Token found) {
        Objects.requireNonNull(found, "found token cannot be null");
        return new SyntaxException(Kind.UNEXPECTED_TOKEN, found.position(), expected, found, null,
                "expected " + expected + " but found " + found.describe());
    }

    public static SyntaxException emptyProgram(SourcePosition position) {
        return new SyntaxException(Kind.EMPTY_PROGRAM, position, "expression", null, null,
                "program has no expression to evaluate");
    }

    public static SyntaxException duplicateAssignment(String name, SourcePosition position) {
        return new SyntaxException(Kind.DUPLICATE_ASSIGNMENT, position, null, null, name,
                "variable '" + name + "' is already assigned");
    }

    public static SyntaxException nestingTooDeep(int maxDepth, SourcePosition position) {
        return new SyntaxException(Kind.NESTING_TOO_DEEP, position, null, null, null,
                "expression nests deeper than " + maxDepth
                        + " levels (each '~', '(' and chained binary operator counts as one)");
    }

    public static SyntaxException sourceTooLong(int length, LogicPolicy policy) {
        return new SyntaxException(Kind.SOURCE_TOO_LONG, null, null, null, null, String.format(
                "source too long (%d characters, max: %d). Policy applied: %s",
                length, policy.maxSourceLength(), policy.policyName()));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return where the error was detected; empty only for {@link Kind#SOURCE_TOO_LONG}
     */
    public Optional<SourcePosition> getPosition() {
        return Optional.ofNullable(position);
    }

    public Optional<String> getExpected() {
        return Optional.ofNullable(expected);
    }

    public Optional<Token> getFound() {
        return Optional.ofNullable(found);
    }

    /**
     * @return the offending variable name, present for {@link Kind#DUPLICATE_ASSIGNMENT}
     */
    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }
}
