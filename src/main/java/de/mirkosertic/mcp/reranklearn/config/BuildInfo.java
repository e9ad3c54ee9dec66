package de.mirkosertic.mcp.reranklearn.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version of this server as reported to MCP clients.
 * Read from the Maven-filtered {@code build-info.properties}; "dev"/"unknown" when
 * running from an IDE without resource filtering.
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final Properties PROPERTIES = loadProperties();

    private BuildInfo() {
    }

    private static Properties loadProperties() {
        final Properties props = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream("build-info.properties")) {
            if (input != null) {
                props.load(input);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load build info, using defaults", e);
        }
        return props;
    }

    public static String getVersion() {
        final String version = PROPERTIES.getProperty("build.version", "dev");
        // Unfiltered resources still contain the raw placeholder
        return version.startsWith("${") ? "dev" : version;
    }

    public static String getBuildTimestamp() {
        final String timestamp = PROPERTIES.getProperty("build.timestamp", "unknown");
        return timestamp.startsWith("${") ? "unknown" : timestamp;
    }
}
