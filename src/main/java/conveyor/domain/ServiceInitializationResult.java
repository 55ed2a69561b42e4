package conveyor.domain;

/**
 * Result of checking one backend or device at startup
 * @since 10/10/2025
 */
public class ServiceInitializationResult {
    private final String serviceName;
    private final String category;
    private final boolean success;
    private final String errorMessage;
    private final Exception exception;
    private final long initializationTimeMs;

    private ServiceInitializationResult(String serviceName, String category, boolean success,
                                        String errorMessage, Exception exception,
                                        long initializationTimeMs) {
        this.serviceName = serviceName;
        this.category = category;
        this.success = success;
        this.errorMessage = errorMessage;
        this.exception = exception;
        this.initializationTimeMs = initializationTimeMs;
    }

    /**
     * Create a successful initialization result
     */
    public static ServiceInitializationResult success(String serviceName, String category, long initTimeMs) {
        return new ServiceInitializationResult(serviceName, category, true, null, null, initTimeMs);
    }

    /**
     * Create a failed initialization result
     */
    public static ServiceInitializationResult failure(String serviceName, String category, Exception exception, long initTimeMs) {
        return new ServiceInitializationResult(serviceName, category, false, exception.getMessage(), exception, initTimeMs);
    }

    /**
     * Create a failed initialization result with custom message
     */
    public static ServiceInitializationResult failure(String serviceName, String category, String errorMessage, long initTimeMs) {
        return new ServiceInitializationResult(serviceName, category, false, errorMessage, null, initTimeMs);
    }

    public String getServiceName() {
        return serviceName;
    }

    /**
     * Get group of the checked item: slicer, driver or device
     */
    public String getCategory() {
        return category;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Exception getException() {
        return exception;
    }

    public long getInitializationTimeMs() {
        return initializationTimeMs;
    }

    @Override
    public String toString() {
        if (success) {
            return String.format("%s '%s': SUCCESS (checked in %dms)", category, serviceName, initializationTimeMs);
        } else {
            return String.format("%s '%s': FAILED (attempted for %dms) - %s",
                    category, serviceName, initializationTimeMs, errorMessage);
        }
    }
}
