package io.github.cyfko.proplogic.core.lexer;

/**
 * Location of a character in the statement source.
 *
 * @param offset 0-based character offset from the start of the source
 * @param line   1-based line number
 * @param column 1-based column number within the line
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SourcePosition(int offset, int line, int column) {

    /**
     * Position of the very first character of any source.
     */
    public static final SourcePosition START = new SourcePosition(0, 1, 1);

    public SourcePosition {
        if (offset < 0 || line < 1 || column < 1) {
            throw new IllegalArgumentException(String.format(
                    "Invalid source position (offset=%d, line=%d, column=%d)", offset, line, column));
        }
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
