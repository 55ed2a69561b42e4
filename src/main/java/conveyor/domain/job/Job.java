package conveyor.domain.job;

import conveyor.common.EJobKind;
import conveyor.dal.DriverProfile;
import conveyor.dal.SlicerProfile;
import conveyor.dal.SlicingSettings;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A job. Owned by {@link JobQueue}: every mutable field is written under the queue lock,
 * everything else in the code base works with ids and {@link JobSnapshot}s.
 *
 * @since 16/10/2025
 */
public final class Job {
    private final String id;
    private final long sequence;
    private final EJobKind kind;
    private final Path modelPath;
    private final SlicerProfile slicerProfile;
    private final DriverProfile driverProfile;
    private final String deviceId;
    private final SlicingSettings settings;
    private final String buildName;
    private final String createdAt;
    private final CancellationToken cancellationToken = new CancellationToken();

    private JobState state = JobState.CREATED;
    private final List<StateTransition> history = new ArrayList<>();
    private String error;
    private double progress;
    private double publishedProgress;
    private long currentLine;
    private long totalLines;
    private boolean cancelRequested;
    private Path toolpath;
    private Path outputPath;

    Job(String id, long sequence, EJobKind kind, Path modelPath, SlicerProfile slicerProfile, DriverProfile driverProfile,
        String deviceId, SlicingSettings settings, String buildName, Path outputPath, String createdAt) {
        this.id = id;
        this.sequence = sequence;
        this.kind = kind;
        this.outputPath = outputPath;
        this.modelPath = modelPath;
        this.slicerProfile = slicerProfile;
        this.driverProfile = driverProfile;
        this.deviceId = deviceId;
        this.settings = settings;
        this.buildName = buildName;
        this.createdAt = createdAt;
        this.history.add(new StateTransition(null, JobState.CREATED, createdAt));
    }

    public String getId() {
        return id;
    }

    public long getSequence() {
        return sequence;
    }

    public EJobKind getKind() {
        return kind;
    }

    public Path getModelPath() {
        return modelPath;
    }

    public SlicerProfile getSlicerProfile() {
        return slicerProfile;
    }

    public DriverProfile getDriverProfile() {
        return driverProfile;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public SlicingSettings getSettings() {
        return settings;
    }

    public String getBuildName() {
        return buildName;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    JobState getState() {
        return state;
    }

    void transition(JobState target, String timestamp) {
        history.add(new StateTransition(state, target, timestamp));
        state = target;
    }

    void setError(String error) {
        this.error = error;
    }

    void markCancelRequested() {
        this.cancelRequested = true;
    }

    /**
     * Store progress, returns true when the change is large enough to be published
     */
    boolean updateProgress(double fraction, long line, long lines, double step) {
        this.progress = Math.max(progress, Math.min(1.0, fraction));
        this.currentLine = line;
        this.totalLines = lines;
        if (progress - publishedProgress >= step || (progress >= 1.0 && publishedProgress < 1.0)) {
            publishedProgress = progress;
            return true;
        }
        return false;
    }

    void markComplete() {
        this.progress = 1.0;
        this.publishedProgress = 1.0;
        if (totalLines > 0) {
            this.currentLine = totalLines;
        }
    }

    double getProgress() {
        return progress;
    }

    void setToolpath(Path toolpath) {
        this.toolpath = toolpath;
    }

    Path getToolpath() {
        return toolpath;
    }

    void setOutputPath(Path outputPath) {
        this.outputPath = outputPath;
    }

    /**
     * Requested result file, null until resolved for jobs that did not name one
     */
    Path getOutputPath() {
        return outputPath;
    }

    JobSnapshot snapshot(Integer position) {
        return new JobSnapshot(id, sequence, kind, modelPath.toString(), slicerProfile.name(),
                driverProfile == null ? null : driverProfile.name(),
                deviceId, buildName, state, Collections.unmodifiableList(new ArrayList<>(history)), error,
                progress, currentLine, totalLines, position, cancelRequested,
                toolpath == null ? null : toolpath.toString(),
                kind == EJobKind.PRINT_TO_FILE && outputPath != null ? outputPath.toString() : null, createdAt);
    }
}
