package de.mirkosertic.sqlsync.cli;

import de.mirkosertic.sqlsync.config.BuildInfo;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 * Top level command. Without a subcommand it prints the usage.
 */
@CommandLine.Command(
        name = "sql-index-sync",
        mixinStandardHelpOptions = true,
        versionProvider = BuildInfo.class,
        description = "Keeps search indexes in sync with SQL database tables.",
        subcommands = {RunCommand.class, GenerateCommand.class, ValidateCommand.class})
public class SqlIndexSyncCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_SYNC_FAILED = 1;
    static final int EXIT_CONFIGURATION = 2;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_OK;
    }
}
