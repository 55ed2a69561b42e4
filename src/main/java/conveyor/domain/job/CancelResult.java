package conveyor.domain.job;

/**
 * Outcome of a cancel request
 */
public enum CancelResult {
    OK,
    NOT_FOUND,
    ALREADY_TERMINAL
}
