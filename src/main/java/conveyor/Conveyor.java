package conveyor;

import com.google.inject.Guice;
import com.google.inject.Injector;
import conveyor.dal.ConfigurationLoader;
import conveyor.dal.ConfigurationService;
import conveyor.dal.ServerConfig;
import conveyor.domain.ConveyorController;
import conveyor.domain.StartupException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.FileAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Main entry point of the Conveyor print dispatch daemon.
 * <p>An optional first argument names the configuration file, otherwise
 * {@code config/conveyor.properties} and the classpath copy are used.</p>
 *
 * @since 24/09/2025
 */
public class Conveyor {
    private static final Logger logger = LoggerFactory.getLogger(Conveyor.class);
    private static final String LOG_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%t] %-5level %logger{36} - %msg%n";

    public static void main(String[] args) {
        logger.info("Starting Conveyor print dispatch daemon...");

        try {
            ConfigurationLoader loader = args.length > 0 ? new ConfigurationLoader(args[0]) : new ConfigurationLoader();
            ConfigurationService configService = new ConfigurationService(loader);
            ServerConfig serverConf = configService.getServerConfiguration();

            configureLogging(serverConf);

            logger.info("Configuration loaded successfully");
            logger.debug("Server: {}", serverConf);
            logger.debug("Slicer profiles: {}", configService.getSlicerProfiles().keySet());
            logger.debug("Driver profiles: {}", configService.getDriverProfiles().keySet());
            logger.debug("Devices: {}", configService.getDevices());

            writePidFile(serverConf.pidFile());

            Injector injector = Guice.createInjector(new GuiceModule(configService));
            ConveyorController app = injector.getInstance(ConveyorController.class);

            // Start with configured startup mode
            app.start();

        } catch (StartupException e) {
            logger.error("Daemon startup failed:");
            logger.error("  Mode: {}", e.getMode());
            logger.error("  Failed checks: {}", e.getFailedServices().size());
            for (var result : e.getFailedServices()) {
                logger.error("    - {}", result);
            }
            System.exit(1);

        } catch (Exception e) {
            logger.error("Failed to start daemon", e);
            System.exit(1);
        }
    }

    /**
     * Apply level, enable flag and optional log file from the server configuration
     */
    static void configureLogging(ServerConfig serverConf) {
        if (!serverConf.loggingEnabled()) {
            Configurator.setRootLevel(Level.OFF);
            return;
        }
        Configurator.setRootLevel(Level.toLevel(serverConf.loggingLevel(), Level.INFO));

        if (serverConf.loggingFile() != null && !serverConf.loggingFile().trim().isEmpty()) {
            Path file = serverConf.workDir().resolve(serverConf.loggingFile().trim());
            LoggerContext context = (LoggerContext) LogManager.getContext(false);
            Configuration config = context.getConfiguration();
            PatternLayout layout = PatternLayout.newBuilder()
                    .withPattern(LOG_PATTERN)
                    .withConfiguration(config)
                    .build();
            FileAppender appender = FileAppender.newBuilder()
                    .setName("ConveyorFile")
                    .withFileName(file.toString())
                    .setLayout(layout)
                    .setConfiguration(config)
                    .build();
            appender.start();
            config.addAppender(appender);
            config.getRootLogger().addAppender(appender, null, null);
            context.updateLoggers();
            logger.info("Logging to file {}", file);
        }
    }

    private static void writePidFile(Path pidFile) throws IOException {
        if (pidFile == null) {
            return;
        }
        Path parent = pidFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(pidFile, ProcessHandle.current().pid() + System.lineSeparator(), StandardCharsets.UTF_8);
        logger.info("PID {} written to {}", ProcessHandle.current().pid(), pidFile);
    }
}
