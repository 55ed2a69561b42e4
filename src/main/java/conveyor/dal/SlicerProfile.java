package conveyor.dal;

import conveyor.common.EProfileKind;
import conveyor.common.ESlicerBackend;

import java.nio.file.Path;

/**
 * Type-safe slicer profile
 *
 * @param executable slicer executable (Miracle Grue binary or Skeinforge craft script)
 * @param configPath Miracle Grue JSON configuration or Skeinforge profile directory
 * @param interpreter interpreter used to run a script backend, may be null
 * @param startGcode optional G-code file prepended by the slicer
 * @param endGcode optional G-code file appended by the slicer
 * @param timeoutMs maximum duration of one slicer invocation
 * @since 14/10/2025
 */
public record SlicerProfile(String name,
                            ESlicerBackend backend,
                            Path executable,
                            Path configPath,
                            String interpreter,
                            Path startGcode,
                            Path endGcode,
                            long timeoutMs) implements Profile {

    /**
     * Factory method: in-process slicer used in dummy mode and tests
     */
    public static SlicerProfile dummy(String name) {
        return new SlicerProfile(name, ESlicerBackend.DUMMY, null, null, null, null, null, 60_000);
    }

    @Override
    public EProfileKind kind() {
        return EProfileKind.SLICER;
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
            throw new ConfigurationException("Slicer profile name cannot be empty");
        }
        if (backend == null) {
            throw new ConfigurationException("Slicer backend cannot be null for profile '" + name + "'");
        }
        if (backend != ESlicerBackend.DUMMY && executable == null) {
            throw new ConfigurationException("Slicer profile '" + name + "' requires an executable");
        }
        if (timeoutMs < 1000) {
            throw new ConfigurationException("Slicer timeout must be at least 1000ms for profile '" + name + "'");
        }
    }
}
