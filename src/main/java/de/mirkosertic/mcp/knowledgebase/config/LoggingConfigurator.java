package de.mirkosertic.mcp.knowledgebase.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches logging to the deployed setup once the configuration is known.
 * <p>
 * Until then the classpath logback.xml logs to stderr, which is safe for the STDIO
 * transport. In deployed mode logback-deployed.xml takes over and writes only to the
 * configured log directory, exposed to the XML as {@code ${LOG_DIR}}.
 */
public final class LoggingConfigurator {

    static final String DEPLOYED_CONFIG = "logback-deployed.xml";
    static final String LOG_DIR_PROPERTY = "LOG_DIR";

    private LoggingConfigurator() {
    }

    /**
     * @return true if the deployed logging setup is active afterwards
     */
    public static boolean configure(final ApplicationConfig config) {
        if (!config.isDeployedMode()) {
            return false;
        }
        final Path logDir = Path.of(config.getLogDir());
        try {
            Files.createDirectories(logDir);
        } catch (final IOException e) {
            System.err.println("Cannot create log directory " + logDir + ", keeping console logging: " + e);
            return false;
        }
        return apply(DEPLOYED_CONFIG, logDir);
    }

    static boolean apply(final String resource, final Path logDir) {
        final URL configUrl = LoggingConfigurator.class.getClassLoader().getResource(resource);
        if (configUrl == null) {
            System.err.println("Logging setup " + resource + " is missing from the classpath, keeping console logging");
            return false;
        }

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();
        context.putProperty(LOG_DIR_PROPERTY, logDir.toAbsolutePath().toString());

        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        try (InputStream in = configUrl.openStream()) {
            configurator.doConfigure(in);
            return true;
        } catch (final JoranException | IOException e) {
            System.err.println("Applying " + resource + " failed: " + e.getMessage());
            return false;
        }
    }
}
