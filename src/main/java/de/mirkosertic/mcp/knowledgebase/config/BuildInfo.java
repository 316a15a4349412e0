package de.mirkosertic.mcp.knowledgebase.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build timestamp of the running server, taken from the Maven-filtered
 * build-info.properties. Outside a Maven build (IDE runs) "dev" and "unknown" are reported.
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";
    private static final String DEV_VERSION = "dev";
    private static final String UNKNOWN_TIMESTAMP = "unknown";

    private static final Properties properties = loadProperties();

    private BuildInfo() {
    }

    private static Properties loadProperties() {
        final Properties props = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input == null) {
                logger.debug("{} not on classpath, reporting development build", BUILD_INFO_FILE);
                return props;
            }
            props.load(input);
        } catch (final IOException e) {
            logger.warn("Failed to read {}, reporting development build", BUILD_INFO_FILE, e);
        }
        return props;
    }

    private static String property(final String key, final String fallback) {
        final String value = properties.getProperty(key);
        // Unfiltered placeholders show up when resources were copied without Maven filtering
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return fallback;
        }
        return value.trim();
    }

    public static String getVersion() {
        return property("build.version", DEV_VERSION);
    }

    public static String getBuildTimestamp() {
        return property("build.timestamp", UNKNOWN_TIMESTAMP);
    }

    /**
     * Server name reported in the MCP initialize handshake.
     */
    public static String getServerName() {
        return "mcp-knowledgebase-server";
    }

    /**
     * One line banner for the startup log.
     */
    public static String describe() {
        return getServerName() + " " + getVersion() + " (built " + getBuildTimestamp() + ")";
    }
}
