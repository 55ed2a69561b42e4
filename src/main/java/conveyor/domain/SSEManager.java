package conveyor.domain;

import com.google.gson.Gson;
import conveyor.common.ServerConstants;
import conveyor.domain.job.JobEvent;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Manages SSE clients of the job event stream
 * @since 16/10/2025
 */
public class SSEManager {
    private static final Logger logger = LoggerFactory.getLogger(SSEManager.class);
    public static final String JOB_EVENT = "job";

    private final ConcurrentHashMap<String, SSEClient> jobSSEClients = new ConcurrentHashMap<>();
    private final Gson compactGson;

    private ScheduledFuture<?> sseCleanupTask;
    private ScheduledFuture<?> sseHeartbeatTask;
    private Disposable eventSubscription;

    public SSEManager(Gson compactGson) {
        this.compactGson = compactGson;
    }

    /**
     * Register a client
     * @return false when the client limit is reached
     */
    public boolean register(SSEClient client) {
        if (jobSSEClients.size() >= ServerConstants.SSE_MAX_CLIENTS) {
            return false;
        }
        jobSSEClients.put(client.getClientId(), client);
        logger.info("Job SSE client registered: {} (total clients: {})", client.getClientId(), jobSSEClients.size());
        return true;
    }

    /**
     * Unregister a client, other subscriptions are not affected
     */
    public void unregister(String clientId) {
        SSEClient client = jobSSEClients.remove(clientId);
        if (client != null) {
            client.close();
            logger.info("Job SSE client unregistered: {} (total clients: {})", clientId, jobSSEClients.size());
        }
    }

    public int getClientCount() {
        return jobSSEClients.size();
    }

    /**
     * Forward job events to SSE clients on {@code scheduler}, so slow clients never hold up job transitions
     */
    public synchronized void subscribe(Observable<JobEvent> events, Scheduler scheduler) {
        if (eventSubscription != null) {
            eventSubscription.dispose();
        }
        eventSubscription = events
                .observeOn(scheduler)
                .subscribe(this::broadcast,
                        error -> logger.error("Job event stream failed", error),
                        () -> logger.info("Job event stream completed"));
    }

    /**
     * Broadcast one job event to every client subscribed to it
     */
    public void broadcast(JobEvent event) {
        if (jobSSEClients.isEmpty()) {
            return;
        }

        String data = compactGson.toJson(event);
        int failureCount = 0;
        for (SSEClient client : jobSSEClients.values()) {
            if (client.accepts(event.jobId()) && !client.sendEvent(JOB_EVENT, data)) {
                failureCount++;
                logger.debug("Failed to send to job client: {}", client);
            }
        }

        if (failureCount > 0) {
            logger.debug("Job event broadcast: {} failed", failureCount);
        }
    }

    /**
     * Send heartbeat to all SSE clients to keep connections alive
     */
    void sendHeartbeatToAllClients() {
        for (SSEClient client : jobSSEClients.values()) {
            if (client.needsHeartbeat(ServerConstants.SSE_HEARTBEAT_INTERVAL_MS) && !client.sendHeartbeat()) {
                logger.debug("Heartbeat failed for job client: {}", client);
            }
        }
    }

    /**
     * Clean up inactive and stale SSE clients
     */
    void cleanupStaleSSEClients() {
        int removedCount = 0;
        for (var entry : jobSSEClients.entrySet()) {
            SSEClient client = entry.getValue();
            if (!client.isActive() || client.isStale(ServerConstants.SSE_CLIENT_TIMEOUT_MS)) {
                String reason = !client.isActive() ? "inactive" : "stale";
                logger.info("Removing {} job SSE client: {}", reason, client.getClientId());
                client.close();
                jobSSEClients.remove(entry.getKey());
                removedCount++;
            }
        }

        if (removedCount > 0) {
            logger.info("Cleaned up {} SSE clients", removedCount);
        }
    }

    /**
     * Start SSE management background tasks
     */
    public void startSSEManagementTasks(ScheduledExecutorService executorService) {
        sseCleanupTask = executorService.scheduleWithFixedDelay(
                this::cleanupStaleSSEClients,
                ServerConstants.SSE_CLEANUP_INTERVAL_MS,
                ServerConstants.SSE_CLEANUP_INTERVAL_MS,
                TimeUnit.MILLISECONDS
        );
        sseHeartbeatTask = executorService.scheduleWithFixedDelay(
                this::sendHeartbeatToAllClients,
                ServerConstants.SSE_HEARTBEAT_INTERVAL_MS,
                ServerConstants.SSE_HEARTBEAT_INTERVAL_MS,
                TimeUnit.MILLISECONDS
        );
        logger.info("SSE cleanup and heartbeat tasks started");
    }

    /**
     * Stop SSE management tasks and the event subscription
     */
    public synchronized void stopSSEManagementTasks() {
        if (sseCleanupTask != null) {
            sseCleanupTask.cancel(false);
        }
        if (sseHeartbeatTask != null) {
            sseHeartbeatTask.cancel(false);
        }
        if (eventSubscription != null) {
            eventSubscription.dispose();
            eventSubscription = null;
        }
    }

    /**
     * Close all SSE clients
     */
    public void closeAllClients() {
        logger.info("Closing {} job SSE clients", jobSSEClients.size());
        for (SSEClient client : jobSSEClients.values()) {
            client.close();
        }
        jobSSEClients.clear();
    }
}
