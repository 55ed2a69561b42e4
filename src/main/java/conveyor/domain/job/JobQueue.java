package conveyor.domain.job;

import conveyor.common.BackendConstants;
import conveyor.common.EJobEventType;
import conveyor.common.EJobKind;
import conveyor.dal.DriverProfile;
import conveyor.dal.SlicerProfile;
import conveyor.dal.SlicingSettings;
import conveyor.domain.device.DeviceHandle;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.subjects.PublishSubject;
import io.reactivex.rxjava3.subjects.Subject;
import org.joda.time.DateTime;
import org.joda.time.format.ISODateTimeFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owner of all jobs and of the per-device wait lists.
 * <p>Every mutation runs under one lock, so the transitions of a job are totally ordered and
 * events leave in the order they were generated. A job enters its device lane when it is created
 * and leaves it when it starts printing or terminates. Only the lane head may start printing,
 * and only once its toolpath is ready, which keeps entry into PRINTING in submission order.
 * Slice and print-to-file jobs never touch a device and have no lane.</p>
 *
 * @since 16/10/2025
 */
public class JobQueue {
    private static final Logger logger = LoggerFactory.getLogger(JobQueue.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final Map<String, LinkedList<Job>> lanes = new HashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Subject<JobEvent> events = PublishSubject.<JobEvent>create().toSerialized();

    /**
     * Create a print job in CREATED state and append it to its device lane
     */
    public Job create(Path modelPath, SlicerProfile slicerProfile, DriverProfile driverProfile,
                      String deviceId, SlicingSettings settings, String buildName) {
        return create(modelPath, slicerProfile, driverProfile, deviceId, settings, buildName, EJobKind.PRINT, null);
    }

    /**
     * Create a job of any kind in CREATED state, print jobs join their device lane
     */
    public Job create(Path modelPath, SlicerProfile slicerProfile, DriverProfile driverProfile,
                      String deviceId, SlicingSettings settings, String buildName,
                      EJobKind kind, Path outputPath) {
        lock.lock();
        try {
            String now = now();
            Job job = new Job(UUID.randomUUID().toString(), sequence.incrementAndGet(), kind, modelPath,
                    slicerProfile, driverProfile, kind.usesDevice() ? deviceId : null, settings, buildName,
                    outputPath, now);
            jobs.put(job.getId(), job);
            if (kind.usesDevice()) {
                lanes.computeIfAbsent(deviceId, k -> new LinkedList<>()).addLast(job);
            }
            logger.info("Job {} created (#{}, {}, model={}, device={})", job.getId(), job.getSequence(), kind,
                    modelPath, job.getDeviceId());
            publish(new JobEvent(EJobEventType.STATE_CHANGED, job.getId(), null, JobState.CREATED, 0.0, null, now));
            return job;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Move a job to {@code target}
     * @return false if the job is already terminal (late transition after a cancel or failure)
     * @throws IllegalTransitionException if the state graph has no such edge, or for a print job
     *         entering PRINTING without {@link #startNext(DeviceHandle)}
     * @throws IllegalArgumentException if the job is unknown
     */
    public boolean advance(String jobId, JobState target, String message) {
        lock.lock();
        try {
            Job job = require(jobId);
            JobState from = job.getState();
            if (from.isTerminal()) {
                logger.debug("Job {} already {}, ignoring transition to {}", jobId, from, target);
                return false;
            }
            boolean viaLane = target == JobState.PRINTING && job.getKind().usesDevice();
            if (viaLane || !from.canTransitionTo(target, job.getKind())) {
                IllegalTransitionException e = new IllegalTransitionException(jobId, from, target);
                logger.error("✗ {}", e.getMessage());
                throw e;
            }
            apply(job, target, message);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Terminate a job as FAILED with the given error detail
     * @return false if the job was already terminal
     */
    public boolean fail(String jobId, String error) {
        lock.lock();
        try {
            Job job = require(jobId);
            if (job.getState().isTerminal()) {
                logger.debug("Job {} already {}, dropping failure: {}", jobId, job.getState(), error);
                return false;
            }
            job.setError(error);
            apply(job, JobState.FAILED, error);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record the toolpath produced for a job
     */
    public void setToolpath(String jobId, Path toolpath) {
        lock.lock();
        try {
            require(jobId).setToolpath(toolpath);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record the resolved result file of a print-to-file job
     */
    public void setOutput(String jobId, Path output) {
        lock.lock();
        try {
            require(jobId).setOutputPath(output);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Start the head of the device lane: acquire the handle and move the job to PRINTING.
     * Nothing happens when the head is still slicing, the lane is empty or the handle is
     * held or detached.
     */
    public Optional<Job> startNext(DeviceHandle handle) {
        lock.lock();
        try {
            LinkedList<Job> lane = lanes.get(handle.getId());
            if (lane == null || lane.isEmpty()) {
                return Optional.empty();
            }
            Job head = lane.getFirst();
            if (head.getState() != JobState.QUEUED) {
                return Optional.empty();
            }
            if (!handle.tryAcquire(head.getId())) {
                logger.debug("Device {} busy or detached, job {} keeps waiting", handle.getId(), head.getId());
                return Optional.empty();
            }
            lane.removeFirst();
            apply(head, JobState.PRINTING, null);
            return Optional.of(head);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Store print progress of a PRINTING job and publish it in one percent steps
     */
    public void updateProgress(String jobId, double fraction, long currentLine, long totalLines) {
        lock.lock();
        try {
            Job job = jobs.get(jobId);
            if (job == null || job.getState() != JobState.PRINTING) {
                return;
            }
            if (job.updateProgress(fraction, currentLine, totalLines, BackendConstants.PROGRESS_EVENT_STEP)) {
                publish(new JobEvent(EJobEventType.PROGRESS, jobId, null, JobState.PRINTING,
                        job.getProgress(), null, now()));
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Apply a cancel request.
     * <p>Jobs that are not printing become CANCELLED at once. A printing job only gets the
     * cancel-requested flag: it turns CANCELLED when the driver confirms the abort. In both cases
     * the job's token is triggered after the lock is released, which forwards the cancel to the
     * running slicer or driver.</p>
     */
    public CancelResult cancel(String jobId) {
        Job job;
        lock.lock();
        try {
            job = jobs.get(jobId);
            if (job == null) {
                return CancelResult.NOT_FOUND;
            }
            if (job.getState().isTerminal()) {
                return CancelResult.ALREADY_TERMINAL;
            }
            job.markCancelRequested();
            if (job.getState() == JobState.PRINTING) {
                logger.info("Cancel requested for printing job {}, waiting for driver abort", jobId);
            } else {
                apply(job, JobState.CANCELLED, "Cancelled by client");
            }
        } finally {
            lock.unlock();
        }
        job.getCancellationToken().cancel();
        return CancelResult.OK;
    }

    public Optional<Job> find(String jobId) {
        lock.lock();
        try {
            return Optional.ofNullable(jobs.get(jobId));
        } finally {
            lock.unlock();
        }
    }

    public Optional<JobState> state(String jobId) {
        lock.lock();
        try {
            Job job = jobs.get(jobId);
            return job == null ? Optional.empty() : Optional.of(job.getState());
        } finally {
            lock.unlock();
        }
    }

    public Optional<JobSnapshot> snapshot(String jobId) {
        lock.lock();
        try {
            Job job = jobs.get(jobId);
            return job == null ? Optional.empty() : Optional.of(job.snapshot(position(job)));
        } finally {
            lock.unlock();
        }
    }

    /**
     * List matching jobs in submission order
     */
    public List<JobSnapshot> list(JobFilter filter) {
        lock.lock();
        try {
            List<JobSnapshot> result = new ArrayList<>();
            for (Job job : jobs.values()) {
                JobSnapshot snapshot = job.snapshot(position(job));
                if (filter.matches(snapshot)) {
                    result.add(snapshot);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ids of all non-terminal jobs in submission order
     */
    public List<String> activeJobIds() {
        lock.lock();
        try {
            List<String> ids = new ArrayList<>();
            for (Job job : jobs.values()) {
                if (!job.getState().isTerminal()) {
                    ids.add(job.getId());
                }
            }
            return ids;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return jobs.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Get event stream, hot: subscribers only see events generated after they subscribe
     */
    public Observable<JobEvent> events() {
        return events.hide();
    }

    /**
     * Complete the event stream, used at shutdown
     */
    public void close() {
        events.onComplete();
    }

    private Job require(String jobId) {
        Job job = jobs.get(jobId);
        if (job == null) {
            throw new IllegalArgumentException("Unknown job " + jobId);
        }
        return job;
    }

    private Integer position(Job job) {
        if (job.getDeviceId() == null) {
            return null;
        }
        LinkedList<Job> lane = lanes.get(job.getDeviceId());
        if (lane == null) {
            return null;
        }
        int index = lane.indexOf(job);
        return index < 0 ? null : index + 1;
    }

    private void apply(Job job, JobState target, String message) {
        JobState from = job.getState();
        String now = now();
        job.transition(target, now);
        if (target == JobState.COMPLETED) {
            job.markComplete();
        }
        if (target.isTerminal() && job.getDeviceId() != null) {
            LinkedList<Job> lane = lanes.get(job.getDeviceId());
            if (lane != null) {
                lane.remove(job);
            }
        }
        logger.info("Job {}: {} -> {}{}", job.getId(), from, target, message == null ? "" : " (" + message + ")");
        publish(new JobEvent(EJobEventType.STATE_CHANGED, job.getId(), from, target, job.getProgress(), message, now));
    }

    private void publish(JobEvent event) {
        events.onNext(event);
    }

    private static String now() {
        return ISODateTimeFormat.dateTime().print(DateTime.now());
    }
}
