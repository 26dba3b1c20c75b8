package de.mirkosertic.archivesync.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.jspecify.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Switches Logback to the rolling file setup of unattended update runs.
 * <p>
 * The deployed profile loads {@value #DEPLOYED_CONFIG} and hands it the log directory as the
 * context property {@value #LOG_DIR_PROPERTY}. The directory comes from the system property
 * {@value #LOG_DIR_SYSTEM_PROPERTY}, then the environment variable {@value #LOG_DIR_ENV},
 * then {@code ~/.archivesync/log}. Interactive runs keep the console setup of logback.xml.
 */
public final class LoggingConfigurator {

    static final String DEPLOYED_CONFIG = "logback-deployed.xml";
    static final String LOG_DIR_PROPERTY = "LOG_DIR";
    static final String LOG_DIR_SYSTEM_PROPERTY = "archivesync.log.dir";
    static final String LOG_DIR_ENV = "ARCHIVESYNC_LOG_DIR";

    private LoggingConfigurator() {
    }

    /**
     * Must run before anything logs.
     *
     * @param deployedMode true for unattended runs
     * @return true if the deployed configuration was loaded
     */
    public static boolean configure(final boolean deployedMode) {
        if (!deployedMode) {
            return false;
        }
        final Path logDir = logDirectory(System.getProperty(LOG_DIR_SYSTEM_PROPERTY), System.getenv(LOG_DIR_ENV));
        createLogDirectory(logDir);
        return loadConfiguration(DEPLOYED_CONFIG, logDir);
    }

    static Path logDirectory(final @Nullable String property, final @Nullable String environment) {
        if (property != null && !property.isBlank()) {
            return Paths.get(property.trim()).toAbsolutePath();
        }
        if (environment != null && !environment.isBlank()) {
            return Paths.get(environment.trim()).toAbsolutePath();
        }
        return Paths.get(System.getProperty("user.home"), ".archivesync", "log");
    }

    // Logging is not up yet, problems go to stderr
    private static void createLogDirectory(final Path logDir) {
        try {
            Files.createDirectories(logDir);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDir + ": " + e.getMessage());
        }
    }

    static boolean loadConfiguration(final String configFile, final Path logDir) {
        try (final InputStream configStream = LoggingConfigurator.class.getClassLoader()
                .getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath");
                return false;
            }
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.reset();
            // reset() drops context properties, so set it afterwards
            context.putProperty(LOG_DIR_PROPERTY, logDir.toString());
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
            return true;
        } catch (final JoranException e) {
            System.err.println("Warning: Error loading logback configuration " + configFile + ": " + e.getMessage());
        } catch (final IOException e) {
            System.err.println("Warning: Could not read logback configuration " + configFile + ": " + e.getMessage());
        }
        return false;
    }
}
