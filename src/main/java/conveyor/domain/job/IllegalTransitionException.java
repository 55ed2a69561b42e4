package conveyor.domain.job;

/**
 * Raised when a job is asked to move along an edge the state graph does not have.
 * This is a defect in the caller, never a client error.
 */
public class IllegalTransitionException extends IllegalStateException {
    private final String jobId;
    private final JobState from;
    private final JobState to;

    public IllegalTransitionException(String jobId, JobState from, JobState to) {
        super(String.format("Illegal transition for job %s: %s -> %s", jobId, from, to));
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }

    public String getJobId() {
        return jobId;
    }

    public JobState getFrom() {
        return from;
    }

    public JobState getTo() {
        return to;
    }
}
