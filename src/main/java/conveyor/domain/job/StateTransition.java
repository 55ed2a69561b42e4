package conveyor.domain.job;

/**
 * One entry of a job's history
 *
 * @param from previous state, null for the creation entry
 * @param to new state
 * @param timestamp ISO-8601 time of the transition
 */
public record StateTransition(JobState from, JobState to, String timestamp) {
}
