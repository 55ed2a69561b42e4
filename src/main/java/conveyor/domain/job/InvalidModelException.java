package conveyor.domain.job;

/**
 * The submitted model file is missing or has a type no backend can handle
 */
public class InvalidModelException extends Exception {
    public InvalidModelException(String message) {
        super(message);
    }
}
