package conveyor.dal;

/**
 * Exception thrown when configuration is invalid or missing
 * @since 26/09/2025
 */
public class ConfigurationException extends Exception {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
