package de.mirkosertic.boolquery.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build timestamp, read from the Maven-filtered build-info.properties.
 * Falls back to "dev"/"unknown" when the classes were not built by Maven.
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";
    private static final String DEFAULT_VERSION = "dev";
    private static final String DEFAULT_TIMESTAMP = "unknown";

    private static final BuildInfo INSTANCE = load();

    private final String version;
    private final String buildTimestamp;

    private BuildInfo(final String version, final String buildTimestamp) {
        this.version = version;
        this.buildTimestamp = buildTimestamp;
    }

    private static BuildInfo load() {
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input == null) {
                logger.debug("{} not found, using defaults", BUILD_INFO_FILE);
                return new BuildInfo(DEFAULT_VERSION, DEFAULT_TIMESTAMP);
            }
            final Properties props = new Properties();
            props.load(input);
            return new BuildInfo(
                    resolved(props.getProperty("build.version"), DEFAULT_VERSION),
                    resolved(props.getProperty("build.timestamp"), DEFAULT_TIMESTAMP));
        } catch (final IOException e) {
            logger.warn("Failed to load build info, using defaults", e);
            return new BuildInfo(DEFAULT_VERSION, DEFAULT_TIMESTAMP);
        }
    }

    // Unfiltered placeholders show up when resources are copied without Maven filtering
    private static String resolved(final String value, final String fallback) {
        if (value == null || value.isBlank() || value.contains("${")) {
            return fallback;
        }
        return value.trim();
    }

    public static String getVersion() {
        return INSTANCE.version;
    }

    public static String getBuildTimestamp() {
        return INSTANCE.buildTimestamp;
    }

    /**
     * Returns the one-line version banner printed by {@code --version}.
     */
    public static String describe() {
        return "boolquery " + getVersion() + " (built " + getBuildTimestamp() + ")";
    }
}
