package conveyor.common;

/**
 * Slicer and driver backend defaults
 * @since 14/10/2025
 */
public final class BackendConstants {
    private BackendConstants() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    // Slicers
    public static final long SLICER_TIMEOUT_MS = 30 * 60 * 1000;     // 30 minutes
    public static final long PROCESS_TERMINATION_GRACE_MS = 5_000;
    public static final int DIAGNOSTIC_TAIL_LINES = 200;
    public static final String SKEINFORGE_INTERPRETER = "python";
    public static final String SKEINFORGE_EXPORT_SUFFIX = "_export.gcode";

    // Drivers
    public static final long ABORT_GRACE_MS = 10_000;
    public static final long DUMMY_LINE_DELAY_MS = 2;
    public static final int EXIT_DEVICE_DISCONNECTED = 3;
    public static final String DRIVER_ABORT_COMMAND = "abort";
    public static final String DRIVER_PROGRESS_PREFIX = "progress ";
    public static final String BUILD_FILE_EXTENSION = ".x3g";

    // Progress events are published at most once per percent
    public static final double PROGRESS_EVENT_STEP = 0.01;
}
