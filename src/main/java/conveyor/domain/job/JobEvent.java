package conveyor.domain.job;

import conveyor.common.EJobEventType;

/**
 * Event published for every state transition and for progress updates of printing jobs
 *
 * @param type event type
 * @param jobId job the event belongs to
 * @param oldState previous state, null for the creation event and for progress events
 * @param newState current state
 * @param progress print progress fraction in [0,1]
 * @param message optional human readable detail (error detail for FAILED)
 * @param timestamp ISO-8601 time the event was generated
 */
public record JobEvent(EJobEventType type,
                       String jobId,
                       JobState oldState,
                       JobState newState,
                       double progress,
                       String message,
                       String timestamp) {

    public boolean isTerminal() {
        return type == EJobEventType.STATE_CHANGED && newState != null && newState.isTerminal();
    }
}
