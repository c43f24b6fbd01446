package de.mirkosertic.sqlsync.config;

import java.util.List;

/**
 * Invalid static configuration. The application refuses to start.
 */
public class ConfigurationException extends Exception {

    private final List<String> problems;

    public ConfigurationException(final String message) {
        super(message);
        this.problems = List.of(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public ConfigurationException(final List<String> problems) {
        super("Invalid configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
