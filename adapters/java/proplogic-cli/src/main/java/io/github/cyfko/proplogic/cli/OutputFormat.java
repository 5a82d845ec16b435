package io.github.cyfko.proplogic.cli;

import java.util.Locale;

/**
 * Textual rendering of a truth value on standard output.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum OutputFormat {
    /** {@code 1} / {@code 0}, matching the literals of the language. */
    DIGIT("1", "0"),
    /** {@code true} / {@code false}. */
    WORD("true", "false");

    private final String whenTrue;
    private final String whenFalse;

    OutputFormat(String whenTrue, String whenFalse) {
        this.whenTrue = whenTrue;
        this.whenFalse = whenFalse;
    }

    public String render(boolean value) {
        return value ? whenTrue : whenFalse;
    }

    static OutputFormat fromName(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "digit" -> DIGIT;
            case "word" -> WORD;
            default -> throw new CliUsageException("Unknown format '" + name + "'. Expected one of: digit, word");
        };
    }
}
