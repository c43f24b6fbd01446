package de.mirkosertic.sqlsync.cli;

import de.mirkosertic.sqlsync.SqlIndexSyncApplication;
import de.mirkosertic.sqlsync.config.ApplicationConfig;
import de.mirkosertic.sqlsync.config.ConfigurationException;
import de.mirkosertic.sqlsync.config.LoggingConfigurator;
import de.mirkosertic.sqlsync.sync.CycleSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "run", description = "Synchronize the configured tables.")
public class RunCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(RunCommand.class);

    @CommandLine.Option(names = {"-c", "--config"}, required = true, description = "Path to the configuration file.")
    Path configFile;

    @CommandLine.Option(names = "--once", description = "Run a single cycle per table and exit.")
    boolean once;

    @CommandLine.Option(names = "--daemon", description = "Log to ~/.sqlsync/log instead of the console.")
    boolean daemon;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        // Configure logging first, before anything else logs
        LoggingConfigurator.configure(daemon);

        SqlIndexSyncApplication app = null;
        try {
            final ApplicationConfig config = ApplicationConfig.load(configFile);
            config.validate();
            app = new SqlIndexSyncApplication(config);
            app.init();
        } catch (final ConfigurationException e) {
            if (app != null) {
                app.shutdown();
            }
            logger.error("Invalid configuration: {}", e.getMessage());
            final PrintWriter err = spec.commandLine().getErr();
            err.println("Invalid configuration:");
            for (final String problem : e.getProblems()) {
                err.printf("  - %s%n", problem);
            }
            err.flush();
            return SqlIndexSyncCommand.EXIT_CONFIGURATION;
        }

        if (!once) {
            app.start();
            return SqlIndexSyncCommand.EXIT_OK;
        }

        try {
            final List<CycleSummary> summaries = app.runOnce();
            boolean failed = false;
            for (final CycleSummary summary : summaries) {
                if (!summary.isSuccess()) {
                    failed = true;
                    logger.error("Table {} failed: {}", summary.table(), summary.error());
                }
            }
            return failed ? SqlIndexSyncCommand.EXIT_SYNC_FAILED : SqlIndexSyncCommand.EXIT_OK;
        } finally {
            app.shutdown();
        }
    }
}
