package de.mirkosertic.mcp.newsserver.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches logging to the file-only setup when the server runs as a deployed STDIO process.
 * <p>
 * Development runs keep {@code logback.xml} (stderr). In deployed mode {@code logback-deployed.xml}
 * is loaded with {@code LOG_DIR} set to {@link ApplicationConfig#getLogDirectory()}, so stdout
 * carries nothing but JSON-RPC.
 */
public final class LoggingConfigurator {

    static final String LOG_DIR_PROPERTY = "LOG_DIR";
    private static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must be called before anything else logs.
     */
    public static void configure(final boolean deployedMode) {
        if (deployedMode) {
            configureDeployed(ApplicationConfig.getLogDirectory());
        }
    }

    static void configureDeployed(final Path logDirectory) {
        try {
            Files.createDirectories(logDirectory);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDirectory + ": " + e.getMessage());
        }

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();
        // reset() clears context properties, so LOG_DIR goes in afterwards
        context.putProperty(LOG_DIR_PROPERTY, logDirectory.toAbsolutePath().toString());

        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);

        try (InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(DEPLOYED_CONFIG)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + DEPLOYED_CONFIG + " on classpath");
                return;
            }
            configurator.doConfigure(configStream);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        }
    }
}
