package io.github.cyfko.proplogic.core.lexer;

/**
 * Classification of a lexical unit.
 * <p>
 * Each kind carries the human readable form used in diagnostics, e.g.
 * {@code "expected ')' but found end of input"}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenKind {
    LITERAL_0("'0'"),
    LITERAL_1("'1'"),
    IDENT("identifier"),
    NOT("'~'"),
    AND("'^'"),
    OR("'v'"),
    IMPLIES("'=>'"),
    IFF("'<=>'"),
    ASSIGN("':='"),
    LPAREN("'('"),
    RPAREN("')'"),
    NEWLINE("end of line"),
    EOF("end of input");

    private final String description;

    TokenKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
