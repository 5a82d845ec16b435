package io.github.cyfko.proplogic.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Installs the bundled {@code java.util.logging} configuration for command line runs.
 * <p>
 * A configuration supplied through {@code -Djava.util.logging.config.file} always wins.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class LoggingSetup {

    static final String BASE_LOGGER = "io.github.cyfko.proplogic";

    // JUL keeps loggers weakly; a level set on an unreferenced logger can be lost
    private static final Logger baseLogger = Logger.getLogger(BASE_LOGGER);

    private LoggingSetup() {}

    static void install() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = LoggingSetup.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            Logger.getLogger(LoggingSetup.class.getName())
                    .log(Level.WARNING, "Cannot load bundled logging configuration, keeping JVM defaults", e);
        }
    }

    static void enableVerbose() {
        baseLogger.setLevel(Level.FINE);
    }
}
