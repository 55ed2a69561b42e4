package conveyor.domain;

import io.javalin.http.sse.SseClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * SSE subscription of one client connection, optionally limited to a single job
 * @since 16/10/2025
 */
public class SSEClient {
    private static final Logger logger = LoggerFactory.getLogger(SSEClient.class);

    private final String clientId;
    private final SseClient sseClient;
    private final String jobFilter;
    private final long connectedAt;
    private volatile long lastMessageAt;
    private volatile long lastHeartbeatAt;
    private final AtomicLong messagesSent;
    private volatile boolean active;

    /**
     * @param jobFilter job id this client listens to, null for all jobs
     */
    public SSEClient(String clientId, SseClient sseClient, String jobFilter) {
        this.clientId = clientId;
        this.sseClient = sseClient;
        this.jobFilter = jobFilter;
        this.connectedAt = System.currentTimeMillis();
        this.lastMessageAt = connectedAt;
        this.lastHeartbeatAt = connectedAt;
        this.messagesSent = new AtomicLong(0);
        this.active = true;
    }

    /**
     * Check whether an event of {@code jobId} belongs to this subscription
     */
    public boolean accepts(String jobId) {
        return jobFilter == null || jobFilter.equals(jobId);
    }

    /**
     * Send one event
     * @return true if the event was sent, false if the client is gone
     */
    public boolean sendEvent(String event, String data) {
        if (!active || sseClient == null) {
            return false;
        }

        try {
            logger.trace("Sending SSE event '{}' to client {}: {}", event, clientId,
                    data.length() > 100 ? data.substring(0, 100) + "..." : data);
            sseClient.sendEvent(event, data);
            lastMessageAt = System.currentTimeMillis();
            messagesSent.incrementAndGet();
            return true;
        } catch (Exception e) {
            logger.debug("Failed to send event to client {}: {}", clientId, e.getMessage());
            active = false;
            return false;
        }
    }

    /**
     * Send a heartbeat comment
     * @return true if heartbeat was sent successfully
     */
    public boolean sendHeartbeat() {
        if (!active || sseClient == null) {
            return false;
        }

        try {
            sseClient.sendComment("heartbeat");
            lastHeartbeatAt = System.currentTimeMillis();
            return true;
        } catch (Exception e) {
            logger.debug("Failed to send heartbeat to client {}: {}", clientId, e.getMessage());
            active = false;
            return false;
        }
    }

    /**
     * Stale when neither an event nor a heartbeat went out within {@code timeoutMs}
     */
    public boolean isStale(long timeoutMs) {
        long lastActivity = Math.max(lastMessageAt, lastHeartbeatAt);
        return System.currentTimeMillis() - lastActivity > timeoutMs;
    }

    public boolean needsHeartbeat(long heartbeatIntervalMs) {
        return System.currentTimeMillis() - lastHeartbeatAt > heartbeatIntervalMs;
    }

    /**
     * Close the client connection
     */
    public void close() {
        active = false;
        try {
            if (sseClient != null) {
                sseClient.close();
            }
            logger.debug("Closed SSE client {}", clientId);
        } catch (Exception e) {
            logger.debug("Error closing SSE client {}: {}", clientId, e.getMessage());
        }
    }

    public String getClientId() {
        return clientId;
    }

    public String getJobFilter() {
        return jobFilter;
    }

    public long getMessagesSent() {
        return messagesSent.get();
    }

    public boolean isActive() {
        return active;
    }

    @Override
    public String toString() {
        return String.format("SSEClient{id='%s', job=%s, connected=%dms, messages=%d, active=%s}",
                clientId, jobFilter == null ? "*" : jobFilter, System.currentTimeMillis() - connectedAt,
                messagesSent.get(), active);
    }
}
