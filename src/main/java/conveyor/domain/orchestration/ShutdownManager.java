package conveyor.domain.orchestration;

import conveyor.domain.SSEManager;
import conveyor.domain.device.DeviceMonitorService;
import conveyor.domain.job.JobOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Manages graceful shutdown of the daemon
 * @since 19/10/2025
 */
public class ShutdownManager {
    private static final Logger logger = LoggerFactory.getLogger(ShutdownManager.class);

    private final SSEManager sseManager;
    private final WebServerManager webServerManager;
    private final DeviceMonitorService deviceMonitor;
    private final JobOrchestrator jobOrchestrator;
    private final ScheduledExecutorService executorService;
    private final Path pidFile;

    private final AtomicBoolean shutdownDone = new AtomicBoolean(false);
    private volatile boolean shutdownHookRegistered = false;

    /**
     * Constructor
     * @param sseManager SSE manager
     * @param webServerManager Web server manager
     * @param deviceMonitor Device port monitor
     * @param jobOrchestrator Job orchestrator, active jobs are cancelled on shutdown
     * @param executorService Scheduler of the background tasks
     * @param pidFile PID file removed on exit, may be null
     */
    public ShutdownManager(
            SSEManager sseManager,
            WebServerManager webServerManager,
            DeviceMonitorService deviceMonitor,
            JobOrchestrator jobOrchestrator,
            ScheduledExecutorService executorService,
            Path pidFile) {
        this.sseManager = sseManager;
        this.webServerManager = webServerManager;
        this.deviceMonitor = deviceMonitor;
        this.jobOrchestrator = jobOrchestrator;
        this.executorService = executorService;
        this.pidFile = pidFile;
    }

    /**
     * Register shutdown hook
     */
    public void registerShutdownHook() {
        if (!shutdownHookRegistered) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "conveyor-shutdown"));
            shutdownHookRegistered = true;
        }
    }

    /**
     * Graceful shutdown, runs once
     */
    public void shutdown() {
        if (!shutdownDone.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down Conveyor...");

        try {
            // Stop accepting requests first
            webServerManager.stop();

            // Cancel active jobs and wait for the workers
            jobOrchestrator.shutdown();

            // Stop SSE management tasks and drop clients
            sseManager.stopSSEManagementTasks();
            sseManager.closeAllClients();

            // Stop device monitoring
            if (deviceMonitor != null) {
                deviceMonitor.stopMonitoring();
            }

            // Shutdown executor service
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                    logger.warn("Executor did not terminate in time, forcing shutdown");
                    executorService.shutdownNow();
                    if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                        logger.error("Executor did not terminate");
                    }
                }
            } catch (InterruptedException e) {
                executorService.shutdownNow();
                Thread.currentThread().interrupt();
            }

            deletePidFile();

            logger.info("Conveyor shut down successfully");
        } catch (Exception e) {
            logger.error("Error during shutdown", e);
        }
    }

    public boolean isShutdown() {
        return shutdownDone.get();
    }

    private void deletePidFile() {
        if (pidFile == null) {
            return;
        }
        try {
            if (Files.deleteIfExists(pidFile)) {
                logger.debug("Removed PID file {}", pidFile);
            }
        } catch (IOException e) {
            logger.warn("Failed to remove PID file {}: {}", pidFile, e.getMessage());
        }
    }
}
