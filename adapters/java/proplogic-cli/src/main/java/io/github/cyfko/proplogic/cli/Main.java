package io.github.cyfko.proplogic.cli;

import io.github.cyfko.proplogic.core.api.LogicInterpreter;
import io.github.cyfko.proplogic.core.exception.LogicException;
import io.github.cyfko.proplogic.core.export.DotGraphExporter;
import io.github.cyfko.proplogic.core.export.GraphExporter;
import io.github.cyfko.proplogic.core.impl.BasicLogicInterpreter;
import io.github.cyfko.proplogic.core.parser.Program;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line front end: reads a statement file, prints its truth value and optionally writes the
 * expression tree as a Graphviz graph.
 *
 * <pre>
 * $ cat statement.txt
 * p := 1
 * q := 0
 * ~p v ~q
 * $ proplogic --graph=ast.dot statement.txt
 * 1
 * $ dot -Tpng ast.dot -o ast.png
 * </pre>
 *
 * <p>
 * The graph is written right after parsing, so it is produced even when evaluation then fails on an
 * unbound variable.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_STATEMENT_ERROR = 1;
    static final int EXIT_USAGE_ERROR = 2;
    static final int EXIT_IO_ERROR = 3;

    private static final Logger log = Logger.getLogger(Main.class.getName());

    private final PrintStream out;
    private final PrintStream err;
    private final GraphExporter graphExporter;

    Main(PrintStream out, PrintStream err) {
        this(out, err, new DotGraphExporter());
    }

    Main(PrintStream out, PrintStream err, GraphExporter graphExporter) {
        this.out = Objects.requireNonNull(out, "out cannot be null");
        this.err = Objects.requireNonNull(err, "err cannot be null");
        this.graphExporter = Objects.requireNonNull(graphExporter, "graphExporter cannot be null");
    }

    public static void main(String[] args) {
        LoggingSetup.install();
        System.exit(new Main(System.out, System.err).run(args));
    }

    /**
     * Runs the command.
     *
     * @param args command line arguments
     * @return the process exit status
     */
    int run(String... args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (CliUsageException e) {
            err.println("error: " + e.getMessage());
            err.println(CliOptions.USAGE);
            return EXIT_USAGE_ERROR;
        }

        if (options.help()) {
            out.println(CliOptions.USAGE);
            return EXIT_OK;
        }
        if (options.verbose()) {
            LoggingSetup.enableVerbose();
        }

        String source;
        try {
            source = Files.readString(options.statementFile(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.log(Level.FINE, "Failed to read " + options.statementFile(), e);
            err.println("error: cannot read statement file '" + options.statementFile() + "': " + e);
            return EXIT_IO_ERROR;
        }

        LogicInterpreter interpreter = new BasicLogicInterpreter(options.policy());
        try {
            Program program = interpreter.parse(source);

            if (options.hasGraphFile()) {
                graphExporter.export(program.expression(), options.graphFile());
                log.fine(() -> "Wrote expression graph to " + options.graphFile());
            }

            boolean value = interpreter.evaluate(program);
            out.println(options.format().render(value));

            log.info(() -> String.format("%s evaluated to %s", options.statementFile(), value));
            return EXIT_OK;
        } catch (LogicException e) {
            log.log(Level.FINE, "Statement rejected", e);
            err.println(e.getStage().name().toLowerCase(Locale.ROOT) + " error: " + e.getMessage());
            return EXIT_STATEMENT_ERROR;
        } catch (IOException e) {
            log.log(Level.FINE, "Failed to write " + options.graphFile(), e);
            err.println("error: cannot write graph file '" + options.graphFile() + "': " + e);
            return EXIT_IO_ERROR;
        }
    }
}
