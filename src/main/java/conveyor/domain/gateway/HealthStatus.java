package conveyor.domain.gateway;

/**
 * Daemon health summary
 */
public record HealthStatus(String status, int activeJobs, int devices, int attachedDevices, int sseClients, long uptimeMs) {
}
