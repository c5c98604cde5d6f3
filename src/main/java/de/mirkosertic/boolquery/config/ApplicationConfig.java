package de.mirkosertic.boolquery.config;

import de.mirkosertic.boolquery.MatcherOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Configuration for the boolquery command line front end.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.boolquery/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    static final String ENV_MAX_QUERY_LENGTH = "BOOLQUERY_MAX_QUERY_LENGTH";
    static final String ENV_MAX_NESTING_DEPTH = "BOOLQUERY_MAX_NESTING_DEPTH";
    static final String PROP_MAX_QUERY_LENGTH = "boolquery.max-query-length";
    static final String PROP_MAX_NESTING_DEPTH = "boolquery.max-nesting-depth";
    private static final String CONFIG_DIR = ".boolquery";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    private int maxQueryLength = MatcherOptions.DEFAULT_MAX_QUERY_LENGTH;
    private int maxNestingDepth = MatcherOptions.DEFAULT_MAX_NESTING_DEPTH;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        return load(getUserConfigPath(), System.getenv());
    }

    /**
     * Load configuration using an explicit user config file and environment.
     *
     * @param userConfigPath the user config file, ignored if it does not exist
     * @param environment    the environment variables to apply last
     */
    static ApplicationConfig load(final Path userConfigPath, final Map<String, String> environment) {
        final ApplicationConfig config = new ApplicationConfig();

        config.loadFromClasspath();
        config.loadFromFile(userConfigPath);
        config.applySystemProperties();
        config.applyEnvironment(environment);

        logger.info("Configuration loaded: maxQueryLength={}, maxNestingDepth={}",
                config.maxQueryLength, config.maxNestingDepth);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                applyYaml(is, DEFAULT_CONFIG_FILE);
                logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromFile(final Path path) {
        if (path != null && Files.exists(path)) {
            try (final InputStream is = Files.newInputStream(path)) {
                applyYaml(is, path.toString());
                logger.debug("Loaded user config from: {}", path);
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", path, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYaml(final InputStream is, final String source) {
        final Object loaded;
        try {
            loaded = new Yaml().load(is);
        } catch (final YAMLException e) {
            throw new IllegalArgumentException("Malformed YAML in " + source + ": " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map)) {
            return;
        }

        final Object root = ((Map<String, Object>) loaded).get("boolquery");
        if (!(root instanceof Map)) {
            return;
        }

        final Object matcher = ((Map<String, Object>) root).get("matcher");
        if (!(matcher instanceof Map)) {
            return;
        }

        final Map<String, Object> matcherConfig = (Map<String, Object>) matcher;
        if (matcherConfig.containsKey("max-query-length")) {
            this.maxQueryLength = toInt(matcherConfig.get("max-query-length"), "max-query-length", source);
        }
        if (matcherConfig.containsKey("max-nesting-depth")) {
            this.maxNestingDepth = toInt(matcherConfig.get("max-nesting-depth"), "max-nesting-depth", source);
        }
    }

    private void applySystemProperties() {
        final String propQueryLength = System.getProperty(PROP_MAX_QUERY_LENGTH);
        if (propQueryLength != null && !propQueryLength.isBlank()) {
            this.maxQueryLength = toInt(propQueryLength.trim(), PROP_MAX_QUERY_LENGTH, "system properties");
        }
        final String propNestingDepth = System.getProperty(PROP_MAX_NESTING_DEPTH);
        if (propNestingDepth != null && !propNestingDepth.isBlank()) {
            this.maxNestingDepth = toInt(propNestingDepth.trim(), PROP_MAX_NESTING_DEPTH, "system properties");
        }
    }

    private void applyEnvironment(final Map<String, String> environment) {
        final String envQueryLength = environment.get(ENV_MAX_QUERY_LENGTH);
        if (envQueryLength != null && !envQueryLength.isBlank()) {
            this.maxQueryLength = toInt(envQueryLength.trim(), ENV_MAX_QUERY_LENGTH, "environment");
            logger.info("Max query length from environment: {}", this.maxQueryLength);
        }
        final String envNestingDepth = environment.get(ENV_MAX_NESTING_DEPTH);
        if (envNestingDepth != null && !envNestingDepth.isBlank()) {
            this.maxNestingDepth = toInt(envNestingDepth.trim(), ENV_MAX_NESTING_DEPTH, "environment");
            logger.info("Max nesting depth from environment: {}", this.maxNestingDepth);
        }
    }

    // YAML yields Long for large numbers and Double for fractions, neither may be narrowed silently
    private static int toInt(final Object value, final String key, final String source) {
        if (value instanceof Integer) {
            return (Integer) value;
        }
        try {
            return new BigDecimal(String.valueOf(value).trim()).intValueExact();
        } catch (final NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException(
                    "Invalid value '" + value + "' for " + key + " in " + source + ", expected an integer between "
                            + Integer.MIN_VALUE + " and " + Integer.MAX_VALUE, e);
        }
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    /**
     * Builds the matcher limits from the effective configuration.
     *
     * @throws IllegalArgumentException if a configured limit is not positive
     */
    public MatcherOptions toMatcherOptions() {
        return new MatcherOptions(maxQueryLength, maxNestingDepth);
    }

    public int getMaxQueryLength() {
        return maxQueryLength;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }
}
