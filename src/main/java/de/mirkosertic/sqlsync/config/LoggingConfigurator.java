package de.mirkosertic.sqlsync.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches Logback to the daemon configuration when the process runs unattended.
 * <p>
 * Interactive runs keep {@code logback.xml} (console). Daemon runs load {@code logback-daemon.xml},
 * which writes a rolling file below {@code ~/.sqlsync/log} and nothing to the console.
 */
public final class LoggingConfigurator {

    static final String DAEMON_CONFIG = "logback-daemon.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must be called before the first logger is used.
     *
     * @param daemonMode true when running detached from a terminal
     */
    public static void configure(final boolean daemonMode) {
        if (!daemonMode) {
            return;
        }
        final Path logDirectory = getLogDirectory();
        try {
            Files.createDirectories(logDirectory);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDirectory + ": " + e.getMessage());
        }
        loadConfiguration(DAEMON_CONFIG, logDirectory);
    }

    public static Path getLogDirectory() {
        return ApplicationConfig.getConfigDirectory().resolve("log");
    }

    private static void loadConfiguration(final String configFile, final Path logDirectory) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath");
                return;
            }
            context.reset();
            context.putProperty("LOG_DIR", logDirectory.toString());
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration " + configFile + ": " + e.getMessage());
        }
    }
}
