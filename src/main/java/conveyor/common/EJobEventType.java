package conveyor.common;

/**
 * Kinds of job events published to subscribers
 * @since 16/10/2025
 */
public enum EJobEventType {
    STATE_CHANGED,
    PROGRESS
}
