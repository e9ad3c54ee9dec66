package de.mirkosertic.mcp.reranklearn.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches Logback to file-only output when the server runs as an MCP STDIO process.
 * <p>
 * Anything written to stdout in that mode would corrupt the JSON-RPC stream, so
 * {@code logback-deployed.xml} replaces the console configuration from {@code logback.xml}.
 */
public final class LoggingConfigurator {

    private static final String DEPLOYED_CONFIG = "logback-deployed.xml";
    private static final String LOG_DIR_PROPERTY = "reranklearn.log.dir";

    private LoggingConfigurator() {
    }

    /**
     * Must run before the first logger is used.
     *
     * @param deployedMode true if running in deployed mode (STDIO transport)
     */
    public static void configure(final boolean deployedMode) {
        if (!deployedMode) {
            return;
        }
        final Path logDir = ApplicationConfig.getConfigDirectory().resolve("log");
        System.setProperty(LOG_DIR_PROPERTY, logDir.toString());
        try {
            Files.createDirectories(logDir);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDir + ": " + e.getMessage());
        }
        reloadFrom(DEPLOYED_CONFIG);
    }

    private static void reloadFrom(final String configFile) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath");
                return;
            }
            context.reset();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration " + configFile + ": " + e.getMessage());
        }
    }
}
