package conveyor.domain;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.gson.Gson;
import conveyor.common.ServerConstants;
import conveyor.dal.ServerConfig;
import conveyor.dal.StartupMode;
import conveyor.domain.device.DeviceManager;
import conveyor.domain.device.DeviceMonitorService;
import conveyor.domain.gateway.JobController;
import conveyor.domain.job.JobOrchestrator;
import conveyor.domain.orchestration.ServiceOrchestrator;
import conveyor.domain.orchestration.ShutdownManager;
import conveyor.domain.orchestration.WebServerManager;
import conveyor.domain.profile.ProfileRegistry;
import io.reactivex.rxjava3.schedulers.Schedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Named;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Daemon controller: backend checks, device monitoring, SSE, web server and shutdown
 * @since 19/10/2025
 */
public class ConveyorController {
    private static final Logger logger = LoggerFactory.getLogger(ConveyorController.class);

    private final ServerConfig serverConfig;
    private final JobOrchestrator jobOrchestrator;

    // Managers
    private final ServiceOrchestrator serviceOrchestrator;
    private final SSEManager sseManager;
    private final WebServerManager webServerManager;
    private final ShutdownManager shutdownManager;

    private final ScheduledExecutorService executorService;

    @Inject
    public ConveyorController(ServerConfig serverConfig,
                              ProfileRegistry profiles,
                              DeviceManager deviceManager,
                              DeviceMonitorService deviceMonitor,
                              JobOrchestrator jobOrchestrator,
                              SSEManager sseManager,
                              JobController jobController,
                              @Named("pretty") Gson gson) {
        this.serverConfig = serverConfig;
        this.jobOrchestrator = jobOrchestrator;
        this.sseManager = sseManager;

        this.executorService = Executors.newScheduledThreadPool(ServerConstants.SCHEDULER_THREADS,
                new ThreadFactoryBuilder().setNameFormat("conveyor-scheduler-%d").setDaemon(true).build());

        this.serviceOrchestrator = new ServiceOrchestrator(profiles, deviceManager, deviceMonitor);
        this.webServerManager = new WebServerManager(serverConfig, jobController, gson);
        this.shutdownManager = new ShutdownManager(sseManager, webServerManager, deviceMonitor, jobOrchestrator,
                executorService, serverConfig.pidFile());

        logger.info("ConveyorController initialized with startup mode: {}", serverConfig.startupMode());
    }

    /**
     * Start the daemon with the startup mode from configuration
     * @throws StartupException if startup requirements are not met
     */
    public void start() throws StartupException {
        start(serverConfig.startupMode());
    }

    /**
     * Start the daemon with specified startup mode
     * @param mode Startup mode to use
     * @throws StartupException if startup requirements are not met
     */
    public void start(StartupMode mode) throws StartupException {
        logger.info("========================================");
        logger.info("Starting Conveyor");
        logger.info("Startup Mode: {}", mode);
        logger.info("========================================");

        List<ServiceInitializationResult> results = new ArrayList<>();
        try {
            // Step 1: Check backends and devices
            results = serviceOrchestrator.initializeAllServices();

            // Step 2: Evaluate startup success based on mode
            serviceOrchestrator.evaluateStartupRequirements(mode, results);

            // Step 3: Start device monitoring
            serviceOrchestrator.startMonitoring(executorService);

            // Step 4: Forward job events to SSE clients and start SSE management
            sseManager.subscribe(jobOrchestrator.events(), Schedulers.single());
            sseManager.startSSEManagementTasks(executorService);

            // Step 5: Start web server
            webServerManager.start();

            // Step 6: Register shutdown hook
            shutdownManager.registerShutdownHook();

            // Step 7: Log final status
            serviceOrchestrator.logStartupSummary(results, serverConfig.address());

        } catch (StartupException e) {
            logger.error("Startup failed: {}", e.getMessage());
            shutdownManager.shutdown();  // Cleanup on failure
            throw e;
        } catch (Exception e) {
            logger.error("Unexpected error during startup", e);
            shutdownManager.shutdown();
            throw new StartupException("Unexpected startup failure: " + e.getMessage(), mode, results, e);
        }
    }

    /**
     * Stop the daemon
     */
    public void stop() {
        shutdownManager.shutdown();
    }

    /**
     * Get the port the web server is bound to
     */
    public int getPort() {
        return webServerManager.getPort();
    }

    /**
     * Get initialization results (for testing or status endpoints)
     * @return Map of {@code category:name} to initialization result
     */
    public Map<String, ServiceInitializationResult> getInitializationResults() {
        return serviceOrchestrator.getInitializationResults();
    }
}
