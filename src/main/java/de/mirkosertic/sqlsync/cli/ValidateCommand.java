package de.mirkosertic.sqlsync.cli;

import de.mirkosertic.sqlsync.config.ApplicationConfig;
import de.mirkosertic.sqlsync.config.ConfigurationException;
import de.mirkosertic.sqlsync.config.TableConfig;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "validate", description = "Check a configuration file and print a summary.")
public class ValidateCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"-c", "--config"}, required = true, description = "Path to the configuration file.")
    Path configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        try {
            final ApplicationConfig config = ApplicationConfig.load(configFile);
            config.validate();

            out.printf("Configuration %s is valid%n", configFile);
            out.printf("  database: %s%n", config.getDatabaseType());
            out.printf("  index:    %s%n", ApplicationConfig.INDEX_TYPE_MEILISEARCH.equals(config.getIndexType())
                    ? config.getIndexType() + " at " + config.getMeilisearchHost()
                    : config.getIndexType() + " at " + config.getIndexPath());
            out.printf("  state:    %s%n", config.getStatePath() == null ? "not persisted" : config.getStatePath());
            for (final TableConfig table : config.getTables()) {
                out.printf("  table %s -> index %s (poll %ds, batch %d, delete batch %d, %d concurrent)%n",
                        table.name(), table.indexName(), table.pollIntervalSeconds(), table.batchSize(),
                        table.deleteBatchSize(), table.maxConcurrentBatches());
            }
            out.flush();
            return SqlIndexSyncCommand.EXIT_OK;
        } catch (final ConfigurationException e) {
            err.printf("Configuration %s is invalid:%n", configFile);
            for (final String problem : e.getProblems()) {
                err.printf("  - %s%n", problem);
            }
            err.flush();
            return SqlIndexSyncCommand.EXIT_CONFIGURATION;
        }
    }
}
