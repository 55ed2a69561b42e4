package conveyor.common;

/**
 * Daemon and web server parameters
 * @since 07/10/2025
 */
public final class ServerConstants {
    private ServerConstants() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static final String SERVER_ADDRESS = "tcp:127.0.0.1:9999";
    public static final String PID_FILE = "conveyord.pid";
    public static final int EVENT_THREADS = 4;
    public static final int REQUEST_THREADS = 8;
    public static final int SCHEDULER_THREADS = 2;
    public static final int DEVICE_SCAN_INTERVAL_MS = 10_000;

    // SSE Configuration
    public static final long SSE_CLIENT_TIMEOUT_MS = 300_000;        // 5 minutes
    public static final long SSE_HEARTBEAT_INTERVAL_MS = 30_000;     // 30 seconds
    public static final long SSE_CLEANUP_INTERVAL_MS = 60_000;       // 1 minute
    public static final int SSE_MAX_CLIENTS = 32;

    // Worker pool shutdown
    public static final long WORKER_SHUTDOWN_TIMEOUT_MS = 30_000;
}
