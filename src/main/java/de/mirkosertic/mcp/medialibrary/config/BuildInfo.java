package de.mirkosertic.mcp.medialibrary.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build time of the running server, read from the Maven-filtered
 * {@code build-info.properties}. Unfiltered or missing values fall back to "dev"/"unknown".
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    static final String BUILD_INFO_FILE = "build-info.properties";

    private static final BuildInfo INSTANCE = load(BUILD_INFO_FILE);

    private final String version;
    private final String buildTimestamp;

    BuildInfo(final String version, final String buildTimestamp) {
        this.version = version;
        this.buildTimestamp = buildTimestamp;
    }

    static BuildInfo load(final String resource) {
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                logger.debug("{} not found, running from an unpackaged build", resource);
                return new BuildInfo("dev", "unknown");
            }
            final Properties props = new Properties();
            props.load(input);
            return new BuildInfo(
                    valueOrDefault(props.getProperty("build.version"), "dev"),
                    valueOrDefault(props.getProperty("build.timestamp"), "unknown"));
        } catch (final IOException e) {
            logger.warn("Failed to load build info, using defaults", e);
            return new BuildInfo("dev", "unknown");
        }
    }

    // An unfiltered placeholder means resources were copied without Maven
    private static String valueOrDefault(final String value, final String fallback) {
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return fallback;
        }
        return value;
    }

    public static String getVersion() {
        return INSTANCE.version;
    }

    public static String getBuildTimestamp() {
        return INSTANCE.buildTimestamp;
    }

    public static String describe() {
        return INSTANCE.describeSelf();
    }

    String describeSelf() {
        return "mcp-media-library " + version + " (built " + buildTimestamp + ")";
    }
}
