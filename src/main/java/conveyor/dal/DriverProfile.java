package conveyor.dal;

import conveyor.common.EDriverBackend;
import conveyor.common.EProfileKind;

import java.nio.file.Path;

/**
 * Type-safe printer driver profile
 *
 * @param executable external driver executable, null for the dummy backend
 * @param profileDir machine profile directory passed to the driver
 * @param machine machine type name (e.g. Replicator2)
 * @param lineDelayMs simulated time per toolpath line for the dummy backend
 * @param abortGraceMs time the driver may take to complete its abort sequence
 * @since 14/10/2025
 */
public record DriverProfile(String name,
                            EDriverBackend backend,
                            Path executable,
                            Path profileDir,
                            String machine,
                            long lineDelayMs,
                            long abortGraceMs) implements Profile {

    /**
     * Factory method: simulated printer driver
     */
    public static DriverProfile dummy(String name, long lineDelayMs) {
        return new DriverProfile(name, EDriverBackend.DUMMY, null, null, "Simulated", lineDelayMs, 1_000);
    }

    @Override
    public EProfileKind kind() {
        return EProfileKind.DRIVER;
    }

    @Override
    public String backendName() {
        return backend.name();
    }

    /**
     * Validate configuration based on backend type
     */
    public void validate() throws ConfigurationException {
        if (name == null || name.trim().isEmpty()) {
            throw new ConfigurationException("Driver profile name cannot be empty");
        }
        if (backend == null) {
            throw new ConfigurationException("Driver backend cannot be null for profile '" + name + "'");
        }
        if (backend == EDriverBackend.MAKERBOT && executable == null) {
            throw new ConfigurationException("Driver profile '" + name + "' requires an executable");
        }
        if (lineDelayMs < 0) {
            throw new ConfigurationException("Line delay cannot be negative for profile '" + name + "'");
        }
        if (abortGraceMs < 0) {
            throw new ConfigurationException("Abort grace period cannot be negative for profile '" + name + "'");
        }
    }
}
