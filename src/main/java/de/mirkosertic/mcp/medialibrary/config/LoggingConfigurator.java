package de.mirkosertic.mcp.medialibrary.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches Logback to the file-only configuration when the server talks JSON-RPC over STDIO.
 * Development runs keep the console configuration from {@code logback.xml}.
 */
public final class LoggingConfigurator {

    static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    public static Path logDirectory() {
        return ApplicationConfig.getConfigDirectory().resolve("log");
    }

    /**
     * Must run before the first logger is used.
     */
    public static void configure(final boolean deployedMode) {
        if (!deployedMode) {
            return;
        }
        try {
            Files.createDirectories(logDirectory());
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDirectory() + ": " + e.getMessage());
        }
        loadConfiguration(DEPLOYED_CONFIG);
    }

    private static void loadConfiguration(final String configFile) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (final InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(configFile)) {
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
