package conveyor.dal;

import java.nio.file.Path;

/**
 * Type-safe configuration for the daemon process
 *
 * @since 26/09/2025
 */
public record ServerConfig(ServiceAddress address,
                           Path pidFile,
                           int eventThreads,
                           int requestThreads,
                           StartupMode startupMode,
                           boolean loggingEnabled,
                           String loggingLevel,
                           String loggingFile,
                           int deviceScanInterval,
                           Path workDir) {

    @Override
    public String toString() {
        return String.format("ServerConfiguration{address=%s, eventThreads=%d, requestThreads=%d, startupMode=%s, workDir=%s}",
                address, eventThreads, requestThreads, startupMode, workDir);
    }

    /**
     * Validate configuration
     */
    public void validate() throws ConfigurationException {
        if (address == null) {
            throw new ConfigurationException("Server address cannot be null");
        }
        if (!address.isTcp()) {
            throw new ConfigurationException("Only tcp addresses can be served, got: " + address);
        }
        if (eventThreads < 1) {
            throw new ConfigurationException("Event thread pool size must be at least 1");
        }
        if (requestThreads < 2) {
            throw new ConfigurationException("Request thread pool size must be at least 2");
        }
        if (startupMode == null) {
            throw new ConfigurationException("Startup mode cannot be null");
        }
        if (deviceScanInterval < 1000) {
            throw new ConfigurationException("Device scan interval must be at least 1000ms");
        }
        if (workDir == null) {
            throw new ConfigurationException("Work directory cannot be null");
        }
    }
}
