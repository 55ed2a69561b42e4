package conveyor.dal;

/**
 * Defines how strictly the daemon enforces backend availability at startup
 * @since 10/10/2025
 */
public enum StartupMode {
    /**
     * STRICT mode - Every configured slicer and driver backend must be usable
     * Use for: Production hosts where all tools are installed
     */
    STRICT("All backends must initialize"),

    /**
     * LENIENT mode - At least one slicer and one driver backend must be usable
     * Use for: Hosts where some optional tools are missing
     */
    LENIENT("At least one slicer and one driver must initialize"),

    /**
     * PERMISSIVE mode - Daemon always starts, jobs using missing backends will fail
     * Use for: Testing, debugging, or demonstration mode
     */
    PERMISSIVE("Daemon starts regardless of backend status");

    private final String description;

    StartupMode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return name() + ": " + description;
    }
}
