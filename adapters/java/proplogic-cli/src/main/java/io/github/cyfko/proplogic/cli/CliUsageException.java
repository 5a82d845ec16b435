package io.github.cyfko.proplogic.cli;

/**
 * Exception thrown when the command line arguments cannot be understood.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class CliUsageException extends RuntimeException {

    public CliUsageException(String message) {
        super(message);
    }

    public CliUsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
