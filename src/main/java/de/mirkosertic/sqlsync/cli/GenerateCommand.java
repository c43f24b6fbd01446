package de.mirkosertic.sqlsync.cli;

import de.mirkosertic.sqlsync.config.ApplicationConfig;
import de.mirkosertic.sqlsync.config.ConfigGenerator;
import de.mirkosertic.sqlsync.config.ConfigurationException;
import de.mirkosertic.sqlsync.database.DatabaseAdapter;
import de.mirkosertic.sqlsync.database.DatabaseAdapterFactory;
import de.mirkosertic.sqlsync.database.DatabaseException;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "generate", description = "Generate a configuration from an existing database.")
public class GenerateCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"-d", "--database-url"}, required = true,
            description = "Database URL, e.g. sqlite://path/to/database.db or a JDBC URL.")
    String databaseUrl;

    @CommandLine.Option(names = {"-t", "--index-type"}, defaultValue = ApplicationConfig.INDEX_TYPE_LUCENE,
            description = "Index backend: lucene or meilisearch (default: ${DEFAULT-VALUE}).")
    String indexType;

    @CommandLine.Option(names = {"-m", "--meilisearch-host"}, defaultValue = "http://localhost:7700",
            description = "Meilisearch host (default: ${DEFAULT-VALUE}).")
    String meilisearchHost;

    @CommandLine.Option(names = {"-k", "--meilisearch-key"}, description = "Meilisearch API key.")
    String meilisearchKey;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output file; prints to stdout if omitted.")
    Path output;

    @CommandLine.Option(names = {"-p", "--poll-interval"}, defaultValue = "60",
            description = "Poll interval in seconds (default: ${DEFAULT-VALUE}).")
    long pollInterval;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter err = spec.commandLine().getErr();
        final String databaseType = DatabaseAdapterFactory.detectType(databaseUrl);
        try (final DatabaseAdapter database = DatabaseAdapterFactory.create(databaseType, databaseUrl, 1, 30000)) {
            final ConfigGenerator generator = new ConfigGenerator(database);
            final Map<String, Object> config = generator.generate(new ConfigGenerator.Options(
                    databaseType, databaseUrl, indexType, meilisearchHost, meilisearchKey, pollInterval));
            if (output == null) {
                spec.commandLine().getOut().print(generator.render(config));
                spec.commandLine().getOut().flush();
            } else {
                generator.write(config, output);
                err.printf("Configuration written to %s%n", output);
                err.flush();
            }
            return SqlIndexSyncCommand.EXIT_OK;
        } catch (final ConfigurationException e) {
            err.printf("Invalid arguments: %s%n", e.getMessage());
            err.flush();
            return SqlIndexSyncCommand.EXIT_CONFIGURATION;
        } catch (final DatabaseException | IOException e) {
            err.printf("Cannot generate configuration: %s%n", e.getMessage());
            err.flush();
            return SqlIndexSyncCommand.EXIT_SYNC_FAILED;
        }
    }
}
