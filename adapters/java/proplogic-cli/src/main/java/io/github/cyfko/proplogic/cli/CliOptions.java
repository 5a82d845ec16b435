package io.github.cyfko.proplogic.cli;

import io.github.cyfko.proplogic.core.config.LogicPolicy;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Parsed command line of {@code proplogic}.
 *
 * @param statementFile file holding the statement, {@code null} only when {@code help} is set
 * @param graphFile     where to write the DOT graph of the expression, or {@code null} for none
 * @param policy        parsing limits
 * @param format        rendering of the result
 * @param verbose       whether to log pipeline diagnostics
 * @param help          whether only the usage text was requested
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CliOptions(
    Path statementFile,
    Path graphFile,
    LogicPolicy policy,
    OutputFormat format,
    boolean verbose,
    boolean help
) {

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: proplogic [options] <statement-file>",
            "",
            "Evaluates a propositional-logic statement and prints its truth value.",
            "",
            "Options:",
            "  --policy=NAME    parsing limits: default, strict or relaxed (default: default)",
            "  --graph=FILE     write the expression tree as a Graphviz DOT graph to FILE",
            "  --format=NAME    result rendering: digit (1/0) or word (true/false) (default: digit)",
            "  --verbose        log lexing, parsing and evaluation details to stderr",
            "  -h, --help       print this help and exit",
            "",
            "Exit status: 0 success, 1 statement error, 2 usage error, 3 I/O error");

    public boolean hasGraphFile() {
        return graphFile != null;
    }

    /**
     * Parses the raw arguments.
     *
     * @param args command line arguments
     * @return the options
     * @throws CliUsageException if an option is unknown or malformed, or the statement file is missing or repeated
     */
    public static CliOptions parse(String... args) {
        Path statementFile = null;
        Path graphFile = null;
        LogicPolicy policy = LogicPolicy.defaults();
        OutputFormat format = OutputFormat.DIGIT;
        boolean verbose = false;

        for (String arg : args) {
            if (arg.equals("-h") || arg.equals("--help")) {
                return new CliOptions(null, null, policy, format, verbose, true);
            } else if (arg.equals("--verbose")) {
                verbose = true;
            } else if (arg.startsWith("--policy=")) {
                try {
                    policy = LogicPolicy.named(valueOf(arg));
                } catch (IllegalArgumentException e) {
                    throw new CliUsageException(e.getMessage(), e);
                }
            } else if (arg.startsWith("--graph=")) {
                graphFile = toPath(valueOf(arg));
            } else if (arg.startsWith("--format=")) {
                format = OutputFormat.fromName(valueOf(arg));
            } else if (arg.startsWith("-") && arg.length() > 1) {
                throw new CliUsageException("Unknown option '" + arg + "'");
            } else if (statementFile != null) {
                throw new CliUsageException("Only one statement file is accepted, got '" + statementFile + "' and '" + arg + "'");
            } else {
                statementFile = toPath(arg);
            }
        }

        if (statementFile == null) {
            throw new CliUsageException("Missing statement file");
        }
        return new CliOptions(statementFile, graphFile, policy, format, verbose, false);
    }

    private static String valueOf(String option) {
        String value = option.substring(option.indexOf('=') + 1);
        if (value.isBlank()) {
            throw new CliUsageException("Option '" + option + "' requires a value");
        }
        return value;
    }

    private static Path toPath(String value) {
        try {
            return Path.of(value);
        } catch (InvalidPathException e) {
            throw new CliUsageException("Invalid path '" + value + "': " + e.getReason(), e);
        }
    }
}
