package conveyor.domain.job;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Job list filter, every criterion is optional
 *
 * @param states accepted states, empty accepts all
 * @param deviceId accepted device, null accepts all
 * @param active true keeps only non-terminal jobs, false only terminal ones, null keeps both
 */
public record JobFilter(Set<JobState> states, String deviceId, Boolean active) {

    public JobFilter {
        states = states == null || states.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(states));
    }

    public static JobFilter all() {
        return new JobFilter(null, null, null);
    }

    public boolean matches(JobSnapshot job) {
        if (!states.isEmpty() && !states.contains(job.state())) {
            return false;
        }
        if (deviceId != null && !deviceId.equals(job.deviceId())) {
            return false;
        }
        return active == null || active != job.state().isTerminal();
    }
}
