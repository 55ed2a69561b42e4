package conveyor.domain.job;

import com.google.common.eventbus.Subscribe;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import conveyor.common.BackendConstants;
import conveyor.common.EJobKind;
import conveyor.common.EModelType;
import conveyor.common.ServerConstants;
import conveyor.dal.DriverProfile;
import conveyor.dal.SlicerProfile;
import conveyor.dal.SlicingSettings;
import conveyor.domain.device.DeviceConnectionEvent;
import conveyor.domain.device.DeviceHandle;
import conveyor.domain.device.DeviceManager;
import conveyor.domain.device.DeviceNotFoundException;
import conveyor.domain.device.DeviceStatus;
import conveyor.domain.driver.DeviceDisconnectedException;
import conveyor.domain.driver.DriverFactory;
import conveyor.domain.driver.PrintFailedException;
import conveyor.domain.driver.PrintRequest;
import conveyor.domain.profile.ProfileNotFoundException;
import conveyor.domain.profile.ProfileRegistry;
import conveyor.domain.slicer.SliceFailedException;
import conveyor.domain.slicer.SliceRequest;
import conveyor.domain.slicer.SlicerFactory;
import io.reactivex.rxjava3.core.Observable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives jobs through their lifecycle.
 * <p>Slicing and printing run on a bounded worker pool. Whenever a device may have become
 * free (a job was queued, a print ended, a job was cancelled, a device was re-attached) the head
 * of that device's wait list is started. Adapter failures end here: they become a FAILED job
 * with an error detail and never propagate further. Slice jobs end after slicing and
 * print-to-file jobs run their driver on the slicing worker, neither waits for a device.</p>
 *
 * @since 16/10/2025
 */
public class JobOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(JobOrchestrator.class);
    private static final int ERROR_DIAGNOSTIC_LINES = 20;

    private final JobQueue queue;
    private final ProfileRegistry profiles;
    private final DeviceManager devices;
    private final SlicerFactory slicerFactory;
    private final DriverFactory driverFactory;
    private final SlicingSettings defaultSettings;
    private final Path jobsDir;
    private final ExecutorService workers;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public JobOrchestrator(JobQueue queue,
                           ProfileRegistry profiles,
                           DeviceManager devices,
                           SlicerFactory slicerFactory,
                           DriverFactory driverFactory,
                           SlicingSettings defaultSettings,
                           Path jobsDir,
                           int workerThreads) {
        this.queue = queue;
        this.profiles = profiles;
        this.devices = devices;
        this.slicerFactory = slicerFactory;
        this.driverFactory = driverFactory;
        this.defaultSettings = defaultSettings;
        this.jobsDir = jobsDir;
        this.workers = Executors.newFixedThreadPool(workerThreads,
                new ThreadFactoryBuilder().setNameFormat("conveyor-worker-%d").setDaemon(true).build());
        devices.getEventBus().register(this);
        logger.info("Job orchestrator started ({} worker threads, jobs in {})", workerThreads, jobsDir);
    }

    /**
     * Submit a job. Returns as soon as the job exists, slicing runs in the background.
     * The device is only checked for print jobs and the driver profile is ignored by slice jobs.
     * @return job id
     * @throws ProfileNotFoundException unknown slicer or driver profile, no job is created
     * @throws DeviceNotFoundException unknown device, no job is created
     * @throws InvalidModelException missing model, unsupported model type or a toolpath submitted
     *         for slicing, no job is created
     */
    public String submit(JobRequest request) throws ProfileNotFoundException, DeviceNotFoundException, InvalidModelException {
        if (shuttingDown.get()) {
            throw new IllegalStateException("Daemon is shutting down");
        }
        EJobKind kind = request.kind();
        SlicerProfile slicerProfile = profiles.resolveSlicer(request.slicerProfile());
        DriverProfile driverProfile = kind == EJobKind.SLICE ? null : profiles.resolveDriver(request.driverProfile());
        if (kind.usesDevice()) {
            devices.get(request.deviceId());
        }
        EModelType modelType = validateModel(request.modelPath());
        if (kind == EJobKind.SLICE && modelType == EModelType.GCODE) {
            throw new InvalidModelException("Model is a toolpath already, nothing to slice: " + request.modelPath());
        }
        Path outputPath = request.outputPath() == null ? null : request.outputPath().toAbsolutePath().normalize();

        Path model = request.modelPath().toAbsolutePath().normalize();
        SlicingSettings settings = request.settings() != null ? request.settings() : defaultSettings;
        String buildName = request.buildName() != null && !request.buildName().trim().isEmpty()
                ? request.buildName().trim() : stem(model);

        Job job = queue.create(model, slicerProfile, driverProfile, request.deviceId(), settings, buildName,
                kind, outputPath);
        try {
            workers.execute(() -> runSlicing(job, modelType));
        } catch (RejectedExecutionException e) {
            queue.fail(job.getId(), "Rejected: worker pool is shut down");
        }
        return job.getId();
    }

    /**
     * Convenience form of {@link #submit(JobRequest)} with default settings
     */
    public String submit(Path modelPath, String slicerProfile, String driverProfile, String deviceId)
            throws ProfileNotFoundException, DeviceNotFoundException, InvalidModelException {
        return submit(JobRequest.of(modelPath, slicerProfile, driverProfile, deviceId));
    }

    /**
     * Cancel a job. Jobs that have not started printing are cancelled at once, a printing job
     * is cancelled when its driver has finished the abort sequence.
     */
    public CancelResult cancel(String jobId) {
        CancelResult result = queue.cancel(jobId);
        logger.info("Cancel job {}: {}", jobId, result);
        if (result == CancelResult.OK) {
            queue.find(jobId).filter(job -> job.getKind().usesDevice()).ifPresent(job -> dispatch(job.getDeviceId()));
        }
        return result;
    }

    public Optional<JobSnapshot> status(String jobId) {
        return queue.snapshot(jobId);
    }

    public List<JobSnapshot> list(JobFilter filter) {
        return queue.list(filter == null ? JobFilter.all() : filter);
    }

    /**
     * Get job event stream (state changes and progress)
     */
    public Observable<JobEvent> events() {
        return queue.events();
    }

    public ProfileRegistry profiles() {
        return profiles;
    }

    public List<DeviceStatus> devices() {
        return devices.getStatuses();
    }

    public int activeJobCount() {
        return queue.activeJobIds().size();
    }

    /**
     * Re-attach a device after a disconnection, waiting jobs are started right away
     */
    public void reattach(String deviceId) throws DeviceNotFoundException {
        devices.markAttached(deviceId, "re-attached by client");
        dispatch(deviceId);
    }

    @Subscribe
    public void onDeviceConnection(DeviceConnectionEvent event) {
        if (event.attached()) {
            dispatch(event.deviceId());
        }
    }

    /**
     * Cancel all active jobs and stop the worker pool
     */
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        List<String> active = queue.activeJobIds();
        logger.info("Shutting down orchestrator, cancelling {} active job(s)", active.size());
        for (String jobId : active) {
            queue.cancel(jobId);
        }

        workers.shutdown();
        try {
            if (!workers.awaitTermination(ServerConstants.WORKER_SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                logger.warn("⚠ Workers did not finish in time, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        devices.getEventBus().unregister(this);
        queue.close();
        logger.info("✓ Orchestrator stopped");
    }

    private void runSlicing(Job job, EModelType modelType) {
        String jobId = job.getId();
        boolean sliced = false;
        try {
            if (!queue.advance(jobId, JobState.SLICING, null)) {
                return;
            }

            Path toolpath;
            if (modelType == EModelType.GCODE) {
                logger.info("Job {}: model is a toolpath already, slicing skipped", jobId);
                toolpath = job.getModelPath();
            } else {
                Path output = job.getKind() == EJobKind.SLICE && job.getOutputPath() != null
                        ? job.getOutputPath()
                        : jobsDir.resolve(jobId).resolve(stem(job.getModelPath()) + EModelType.GCODE.getExtension());
                SliceRequest request = new SliceRequest(job.getModelPath(), output, job.getSlicerProfile(), job.getSettings());
                toolpath = slicerFactory.create(job.getSlicerProfile()).slice(request, job.getCancellationToken());
            }

            queue.setToolpath(jobId, toolpath);
            if (job.getKind() == EJobKind.SLICE) {
                queue.advance(jobId, JobState.COMPLETED, null);
            } else if (queue.advance(jobId, JobState.QUEUED, null)) {
                sliced = true;
            }
        } catch (CancellationException e) {
            queue.advance(jobId, JobState.CANCELLED, "Slicing cancelled");
        } catch (SliceFailedException e) {
            logger.error("✗ Slicing failed for job {}: {}", jobId, e.getMessage());
            queue.fail(jobId, "SliceFailed: " + e.getMessage() + diagnostics(e.getDiagnostics()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            queue.advance(jobId, JobState.CANCELLED, "Interrupted during slicing");
        } catch (RuntimeException e) {
            logger.error("✗ Unexpected error while slicing job {}", jobId, e);
            queue.fail(jobId, "SliceFailed: " + e);
        } finally {
            // a lane head that ends here unblocks the jobs queued behind it
            if (job.getKind().usesDevice() && (sliced || queue.state(jobId).map(JobState::isTerminal).orElse(false))) {
                dispatch(job.getDeviceId());
            }
        }

        if (sliced && job.getKind() == EJobKind.PRINT_TO_FILE) {
            runPrintToFile(job);
        }
    }

    private void dispatch(String deviceId) {
        if (shuttingDown.get() || deviceId == null) {
            return;
        }
        DeviceHandle handle;
        try {
            handle = devices.get(deviceId);
        } catch (DeviceNotFoundException e) {
            logger.error("✗ Cannot dispatch: {}", e.getMessage());
            return;
        }

        queue.startNext(handle).ifPresent(job -> {
            try {
                workers.execute(() -> runPrint(job, handle));
            } catch (RejectedExecutionException e) {
                handle.release(job.getId());
                queue.fail(job.getId(), "PrintFailed: worker pool is shut down");
            }
        });
    }

    private void runPrint(Job job, DeviceHandle handle) {
        String jobId = job.getId();
        try {
            PrintRequest request = new PrintRequest(jobId, job.getToolpath(), job.getDriverProfile(), job.getBuildName());
            driverFactory.create(job.getDriverProfile())
                    .print(request, handle, job.getCancellationToken())
                    .blockingSubscribe(
                            progress -> queue.updateProgress(jobId, progress.fraction(), progress.currentLine(), progress.totalLines()),
                            error -> onPrintError(job, handle, error),
                            () -> queue.advance(jobId, JobState.COMPLETED, null));
        } catch (RuntimeException e) {
            logger.error("✗ Unexpected error while printing job {}", jobId, e);
            queue.fail(jobId, "PrintFailed: " + e);
        } finally {
            handle.release(jobId);
            dispatch(handle.getId());
        }
    }

    private void runPrintToFile(Job job) {
        String jobId = job.getId();
        Path output = job.getOutputPath() != null
                ? job.getOutputPath()
                : jobsDir.resolve(jobId).resolve(stem(job.getModelPath()) + BackendConstants.BUILD_FILE_EXTENSION);
        queue.setOutput(jobId, output);
        try {
            if (!queue.advance(jobId, JobState.PRINTING, null)) {
                return;
            }
            PrintRequest request = new PrintRequest(jobId, job.getToolpath(), job.getDriverProfile(), job.getBuildName());
            driverFactory.create(job.getDriverProfile())
                    .printToFile(request, output, job.getCancellationToken())
                    .blockingSubscribe(
                            progress -> queue.updateProgress(jobId, progress.fraction(), progress.currentLine(), progress.totalLines()),
                            error -> onPrintError(job, null, error),
                            () -> queue.advance(jobId, JobState.COMPLETED, null));
        } catch (RuntimeException e) {
            logger.error("✗ Unexpected error while printing job {} to {}", jobId, output, e);
            queue.fail(jobId, "PrintFailed: " + e);
        }
    }

    /**
     * Map a driver error to the job outcome, {@code handle} is null for print-to-file jobs
     */
    private void onPrintError(Job job, DeviceHandle handle, Throwable error) {
        String jobId = job.getId();
        if (error instanceof CancellationException) {
            queue.advance(jobId, JobState.CANCELLED, error.getMessage());
        } else if (error instanceof DeviceDisconnectedException) {
            logger.error("✗ Job {}: {}", jobId, error.getMessage());
            if (handle != null) {
                try {
                    devices.markDetached(handle.getId(), error.getMessage());
                } catch (DeviceNotFoundException e) {
                    logger.error("Device {} vanished", handle.getId(), e);
                }
            }
            queue.fail(jobId, "DeviceDisconnected: " + error.getMessage());
        } else if (error instanceof PrintFailedException) {
            logger.error("✗ Job {}: {}", jobId, error.getMessage());
            queue.fail(jobId, "PrintFailed: " + error.getMessage()
                    + diagnostics(((PrintFailedException) error).getDiagnostics()));
        } else if (error instanceof InterruptedException) {
            queue.advance(jobId, JobState.CANCELLED, "Interrupted during print");
        } else {
            logger.error("✗ Job {}: driver error", jobId, error);
            queue.fail(jobId, "PrintFailed: " + error);
        }
    }

    private static EModelType validateModel(Path modelPath) throws InvalidModelException {
        if (modelPath == null) {
            throw new InvalidModelException("Model path is required");
        }
        EModelType type = EModelType.fromPath(modelPath);
        if (type == null) {
            throw new InvalidModelException("Unsupported model type: " + modelPath);
        }
        if (!Files.isRegularFile(modelPath)) {
            throw new InvalidModelException("Model file not found: " + modelPath);
        }
        return type;
    }

    private static String stem(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String diagnostics(List<String> lines) {
        if (lines.isEmpty()) {
            return "";
        }
        List<String> last = lines.subList(Math.max(0, lines.size() - ERROR_DIAGNOSTIC_LINES), lines.size());
        return System.lineSeparator() + String.join(System.lineSeparator(), last);
    }
}
