package conveyor.domain.job;

import conveyor.common.EJobKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * Job lifecycle states.
 * <p>{@code CREATED -> SLICING -> QUEUED -> PRINTING -> COMPLETED}, with {@code FAILED} and
 * {@code CANCELLED} reachable from every non-terminal state. Terminal states have no exits.
 * Slice-only jobs end with {@code SLICING -> COMPLETED}.</p>
 *
 * @since 16/10/2025
 */
public enum JobState {
    CREATED,
    SLICING,
    QUEUED,
    PRINTING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check whether the state graph allows moving from this state to {@code target}
     */
    public boolean canTransitionTo(JobState target) {
        if (target == null || isTerminal()) {
            return false;
        }
        if (target == FAILED || target == CANCELLED) {
            return true;
        }
        switch (this) {
            case CREATED:
                return target == SLICING;
            case SLICING:
                return target == QUEUED;
            case QUEUED:
                return target == PRINTING;
            case PRINTING:
                return target == COMPLETED;
            default:
                return false;
        }
    }

    /**
     * Check the state graph of a job of the given kind
     */
    public boolean canTransitionTo(JobState target, EJobKind kind) {
        if (kind == EJobKind.SLICE && this == SLICING) {
            return target == COMPLETED || target == FAILED || target == CANCELLED;
        }
        return canTransitionTo(target);
    }

    public static Set<JobState> active() {
        return EnumSet.of(CREATED, SLICING, QUEUED, PRINTING);
    }
}
