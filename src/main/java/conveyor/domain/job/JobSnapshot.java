package conveyor.domain.job;

import conveyor.common.EJobKind;

import java.util.List;

/**
 * Immutable copy of a job as seen by clients
 *
 * @param id opaque job identifier
 * @param sequence submission order, unique and increasing
 * @param position 1-based place in the device wait list for jobs that have not started printing, null otherwise
 * @param toolpath path of the sliced toolpath once available, the result of a slice job
 * @param output build file written by a print-to-file job
 */
public record JobSnapshot(String id,
                          long sequence,
                          EJobKind kind,
                          String model,
                          String slicerProfile,
                          String driverProfile,
                          String deviceId,
                          String buildName,
                          JobState state,
                          List<StateTransition> history,
                          String error,
                          double progress,
                          long currentLine,
                          long totalLines,
                          Integer position,
                          boolean cancelRequested,
                          String toolpath,
                          String output,
                          String createdAt) {
}
