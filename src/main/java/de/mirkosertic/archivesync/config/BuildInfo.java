package de.mirkosertic.archivesync.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build timestamp of the running archivesync build.
 * <p>
 * Read once from the Maven-filtered {@value #BUILD_INFO_FILE}. Missing values and unfiltered
 * placeholders fall back to {@value #DEV_VERSION} and {@value #UNKNOWN_TIMESTAMP}.
 *
 * @param version        project version
 * @param buildTimestamp ISO-8601 build time
 */
public record BuildInfo(String version, String buildTimestamp) {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    static final String BUILD_INFO_FILE = "build-info.properties";
    static final String DEV_VERSION = "dev";
    static final String UNKNOWN_TIMESTAMP = "unknown";

    private static final String VERSION_KEY = "build.version";
    private static final String TIMESTAMP_KEY = "build.timestamp";

    private static final BuildInfo CURRENT = load(BUILD_INFO_FILE);

    /**
     * Build info of the archivesync classes on the classpath.
     */
    public static BuildInfo current() {
        return CURRENT;
    }

    static BuildInfo load(final String resource) {
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                logger.debug("Build info file {} not found, using defaults", resource);
                return fromProperties(new Properties());
            }
            final Properties props = new Properties();
            props.load(input);
            final BuildInfo info = fromProperties(props);
            logger.debug("Loaded build info: version={}, timestamp={}", info.version(), info.buildTimestamp());
            return info;
        } catch (final IOException e) {
            logger.warn("Failed to load build info from {}, using defaults", resource, e);
            return fromProperties(new Properties());
        }
    }

    static BuildInfo fromProperties(final Properties props) {
        return new BuildInfo(
                filtered(props.getProperty(VERSION_KEY), DEV_VERSION),
                filtered(props.getProperty(TIMESTAMP_KEY), UNKNOWN_TIMESTAMP));
    }

    // Unfiltered placeholders count as missing
    static String filtered(final @Nullable String value, final String fallback) {
        if (value == null || value.isBlank() || value.contains("${")) {
            return fallback;
        }
        return value.trim();
    }

    /**
     * One-line description for startup logging, e.g. {@code archivesync 1.0.0 (built 2024-03-01T12:00:00Z)}.
     */
    public String describe() {
        return "archivesync " + version + " (built " + buildTimestamp + ")";
    }
}
