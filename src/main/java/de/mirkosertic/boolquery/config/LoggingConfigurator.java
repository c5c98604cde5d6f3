package de.mirkosertic.boolquery.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Switches the Logback configuration for the command line front end.
 * <p>
 * By default logback.xml is used, which only reports warnings to stderr so that stdout carries
 * nothing but match results. With {@code --verbose}, logback-verbose.xml is loaded instead and
 * debug output goes to stderr.
 */
public final class LoggingConfigurator {

    static final String VERBOSE_CONFIG = "logback-verbose.xml";

    private LoggingConfigurator() {
    }

    /**
     * Configure logging. Must be called before the first log statement that should honor it.
     *
     * @param verbose true to enable debug output
     * @return true if the requested configuration is active
     */
    public static boolean configure(final boolean verbose) {
        if (!verbose) {
            // logback.xml is picked up automatically
            return true;
        }
        return loadConfiguration(VERBOSE_CONFIG);
    }

    private static boolean loadConfiguration(final String configFile) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext)) {
            System.err.println("Warning: Logback is not the active SLF4J backend, ignoring " + configFile);
            return false;
        }
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        try (InputStream configStream = LoggingConfigurator.class.getClassLoader()
                .getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath");
                return false;
            }
            context.reset();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
            return true;
        } catch (final JoranException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
            return false;
        } catch (final IOException e) {
            System.err.println("Warning: Could not read " + configFile + ": " + e.getMessage());
            return false;
        }
    }
}
