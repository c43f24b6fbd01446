package de.mirkosertic.sqlsync.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build time of the running artifact, read from the Maven-filtered
 * {@code build-info.properties}. Outside a packaged build the values are {@code dev} and {@code unknown}.
 * <p>
 * Doubles as the picocli version provider of the command line.
 */
public final class BuildInfo implements CommandLine.IVersionProvider {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    static final String BUILD_INFO_FILE = "build-info.properties";
    static final String DEFAULT_VERSION = "dev";
    static final String DEFAULT_TIMESTAMP = "unknown";

    private static final BuildInfo CURRENT = load(BUILD_INFO_FILE);

    private final String version;
    private final String buildTimestamp;

    private BuildInfo(final String version, final String buildTimestamp) {
        this.version = version;
        this.buildTimestamp = buildTimestamp;
    }

    /**
     * Used by picocli, which instantiates version providers reflectively.
     */
    public BuildInfo() {
        this(CURRENT.version, CURRENT.buildTimestamp);
    }

    static BuildInfo load(final String resource) {
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                logger.debug("{} not found, using development defaults", resource);
                return new BuildInfo(DEFAULT_VERSION, DEFAULT_TIMESTAMP);
            }
            final Properties props = new Properties();
            props.load(input);
            return new BuildInfo(
                    valueOrDefault(props.getProperty("build.version"), DEFAULT_VERSION),
                    valueOrDefault(props.getProperty("build.timestamp"), DEFAULT_TIMESTAMP));
        } catch (final IOException e) {
            logger.warn("Failed to read {}, using development defaults", resource, e);
            return new BuildInfo(DEFAULT_VERSION, DEFAULT_TIMESTAMP);
        }
    }

    // An unfiltered resource still contains the ${...} placeholder
    private static String valueOrDefault(final String value, final String defaultValue) {
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return defaultValue;
        }
        return value;
    }

    public static String currentVersion() {
        return CURRENT.version;
    }

    public static String currentBuildTimestamp() {
        return CURRENT.buildTimestamp;
    }

    String version() {
        return version;
    }

    String buildTimestamp() {
        return buildTimestamp;
    }

    @Override
    public String[] getVersion() {
        return new String[] {"sql-index-sync " + version + " (built " + buildTimestamp + ")"};
    }
}
