package conveyor.domain.job;

import conveyor.common.EJobEventType;
import conveyor.common.EJobKind;
import conveyor.dal.DeviceConfig;
import conveyor.dal.DriverProfile;
import conveyor.dal.SlicerProfile;
import conveyor.dal.SlicingSettings;
import conveyor.domain.device.DeviceHandle;
import io.reactivex.rxjava3.observers.TestObserver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for JobQueue
 * @since 16/10/2025
 */
class JobQueueTest {

    private JobQueue queue;
    private DeviceHandle dev1;

    @BeforeEach
    void setUp() {
        queue = new JobQueue();
        dev1 = new DeviceHandle(DeviceConfig.virtual("dev1"));
    }

    private Job create(String deviceId) {
        return queue.create(Paths.get("/models/part.stl"), SlicerProfile.dummy("s"), DriverProfile.dummy("d", 0),
                deviceId, SlicingSettings.defaults(), "part");
    }

    private void toQueued(Job job) {
        queue.advance(job.getId(), JobState.SLICING, null);
        queue.advance(job.getId(), JobState.QUEUED, null);
    }

    @Test
    @DisplayName("Should create jobs with unique ids and increasing sequence")
    void shouldCreateUniqueJobs() {
        // When
        Job first = create("dev1");
        Job second = create("dev1");

        // Then
        assertThat(first.getId()).isNotEqualTo(second.getId());
        assertThat(second.getSequence()).isGreaterThan(first.getSequence());
        assertThat(queue.state(first.getId())).contains(JobState.CREATED);
        assertThat(queue.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should reject illegal transition loudly")
    void shouldRejectIllegalTransition() {
        // Given
        Job job = create("dev1");

        // When & Then
        assertThatThrownBy(() -> queue.advance(job.getId(), JobState.PRINTING, null))
                .isInstanceOf(IllegalTransitionException.class)
                .hasMessageContaining("CREATED")
                .hasMessageContaining("PRINTING");
        assertThat(queue.state(job.getId())).contains(JobState.CREATED);
    }

    @Test
    @DisplayName("Should ignore transitions of terminal jobs")
    void shouldIgnoreLateTransitions() {
        // Given
        Job job = create("dev1");
        queue.cancel(job.getId());

        // When
        boolean applied = queue.advance(job.getId(), JobState.SLICING, null);
        boolean failed = queue.fail(job.getId(), "late");

        // Then
        assertThat(applied).isFalse();
        assertThat(failed).isFalse();
        assertThat(queue.snapshot(job.getId()).orElseThrow().error()).isNull();
    }

    @Test
    @DisplayName("Should throw for unknown job id")
    void shouldThrowForUnknownJob() {
        assertThatThrownBy(() -> queue.advance("nope", JobState.SLICING, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(queue.cancel("nope")).isEqualTo(CancelResult.NOT_FOUND);
        assertThat(queue.snapshot("nope")).isEmpty();
    }

    @Test
    @DisplayName("Should start only the lane head in submission order")
    void shouldStartLaneHeadInOrder() {
        // Given
        Job first = create("dev1");
        Job second = create("dev1");
        queue.advance(first.getId(), JobState.SLICING, null);
        toQueued(second);

        // When: head is still slicing, the ready second job must wait
        Optional<Job> none = queue.startNext(dev1);

        // Then
        assertThat(none).isEmpty();
        assertThat(queue.snapshot(second.getId()).orElseThrow().position()).isEqualTo(2);

        // When: head becomes ready
        queue.advance(first.getId(), JobState.QUEUED, null);
        Optional<Job> started = queue.startNext(dev1);

        // Then
        assertThat(started).contains(first);
        assertThat(dev1.getHolder()).isEqualTo(first.getId());
        assertThat(queue.snapshot(first.getId()).orElseThrow().position()).isNull();
        assertThat(queue.snapshot(second.getId()).orElseThrow().position()).isEqualTo(1);

        // When: device busy
        assertThat(queue.startNext(dev1)).isEmpty();
        assertThat(queue.state(second.getId())).contains(JobState.QUEUED);
    }

    @Test
    @DisplayName("Should not start jobs while the device is held by another job")
    void shouldNotStartOnBusyDevice() {
        // Given
        Job job = create("dev1");
        toQueued(job);
        dev1.tryAcquire("someone-else");

        // When & Then
        assertThat(queue.startNext(dev1)).isEmpty();
        assertThat(queue.state(job.getId())).contains(JobState.QUEUED);
    }

    @Test
    @DisplayName("Should remove cancelled job from its lane so the next job moves up")
    void shouldRemoveCancelledJobFromLane() {
        // Given
        Job first = create("dev1");
        Job second = create("dev1");
        toQueued(second);

        // When
        CancelResult result = queue.cancel(first.getId());

        // Then
        assertThat(result).isEqualTo(CancelResult.OK);
        assertThat(queue.state(first.getId())).contains(JobState.CANCELLED);
        assertThat(first.getCancellationToken().isCancelled()).isTrue();
        assertThat(queue.startNext(dev1)).contains(second);
    }

    @Test
    @DisplayName("Should only flag a printing job on cancel")
    void shouldFlagPrintingJobOnCancel() {
        // Given
        Job job = create("dev1");
        toQueued(job);
        queue.startNext(dev1);

        // When
        CancelResult result = queue.cancel(job.getId());

        // Then
        JobSnapshot snapshot = queue.snapshot(job.getId()).orElseThrow();
        assertThat(result).isEqualTo(CancelResult.OK);
        assertThat(snapshot.state()).isEqualTo(JobState.PRINTING);
        assertThat(snapshot.cancelRequested()).isTrue();
        assertThat(job.getCancellationToken().isCancelled()).isTrue();
    }

    @Test
    @DisplayName("Should report ALREADY_TERMINAL and keep state on repeated cancel")
    void shouldReportAlreadyTerminal() {
        // Given
        Job job = create("dev1");
        queue.fail(job.getId(), "SliceFailed: boom");

        // When
        CancelResult result = queue.cancel(job.getId());

        // Then
        assertThat(result).isEqualTo(CancelResult.ALREADY_TERMINAL);
        JobSnapshot snapshot = queue.snapshot(job.getId()).orElseThrow();
        assertThat(snapshot.state()).isEqualTo(JobState.FAILED);
        assertThat(snapshot.error()).isEqualTo("SliceFailed: boom");
    }

    @Test
    @DisplayName("Should publish progress in one percent steps and set 1.0 on completion")
    void shouldPublishProgressSteps() {
        // Given
        TestObserver<JobEvent> observer = queue.events().test();
        Job job = create("dev1");
        toQueued(job);
        queue.startNext(dev1);

        // When
        queue.updateProgress(job.getId(), 0.001, 1, 1000);
        queue.updateProgress(job.getId(), 0.015, 15, 1000);
        queue.updateProgress(job.getId(), 0.5, 500, 1000);
        queue.advance(job.getId(), JobState.COMPLETED, null);

        // Then
        List<JobEvent> progress = observer.values().stream()
                .filter(e -> e.type() == EJobEventType.PROGRESS)
                .toList();
        assertThat(progress).extracting(JobEvent::progress).containsExactly(0.015, 0.5);

        JobSnapshot snapshot = queue.snapshot(job.getId()).orElseThrow();
        assertThat(snapshot.progress()).isEqualTo(1.0);
        assertThat(snapshot.currentLine()).isEqualTo(1000);
        assertThat(snapshot.totalLines()).isEqualTo(1000);
    }

    @Test
    @DisplayName("Should publish state events in transition order")
    void shouldPublishStateEventsInOrder() {
        // Given
        TestObserver<JobEvent> observer = queue.events().test();

        // When
        Job job = create("dev1");
        toQueued(job);
        queue.startNext(dev1);
        queue.advance(job.getId(), JobState.COMPLETED, null);

        // Then
        assertThat(observer.values())
                .filteredOn(e -> e.type() == EJobEventType.STATE_CHANGED)
                .extracting(JobEvent::newState)
                .containsExactly(JobState.CREATED, JobState.SLICING, JobState.QUEUED, JobState.PRINTING, JobState.COMPLETED);
        assertThat(observer.values().get(observer.values().size() - 1).isTerminal()).isTrue();
        assertThat(queue.snapshot(job.getId()).orElseThrow().history()).hasSize(5);
    }

    @Test
    @DisplayName("Should filter job list by state, device and activity")
    void shouldFilterList() {
        // Given
        Job a = create("dev1");
        Job b = create("dev2");
        Job c = create("dev1");
        queue.cancel(c.getId());

        // When & Then
        assertThat(queue.list(JobFilter.all())).extracting(JobSnapshot::id).containsExactly(a.getId(), b.getId(), c.getId());
        assertThat(queue.list(new JobFilter(null, "dev1", null))).extracting(JobSnapshot::id).containsExactly(a.getId(), c.getId());
        assertThat(queue.list(new JobFilter(null, null, true))).extracting(JobSnapshot::id).containsExactly(a.getId(), b.getId());
        assertThat(queue.list(new JobFilter(EnumSet.of(JobState.CANCELLED), null, null))).extracting(JobSnapshot::id).containsExactly(c.getId());
        assertThat(queue.activeJobIds()).containsExactly(a.getId(), b.getId());
    }

    @Test
    @DisplayName("Should complete event stream on close")
    void shouldCompleteOnClose() {
        // Given
        TestObserver<JobEvent> observer = queue.events().test();

        // When
        queue.close();

        // Then
        observer.assertComplete();
    }

    @Test
    @DisplayName("Should keep jobs without a device out of the lanes")
    void shouldNotLaneDevicelessJobs() {
        // Given
        Job slice = queue.create(Paths.get("/models/part.stl"), SlicerProfile.dummy("s"), null, "dev1",
                SlicingSettings.defaults(), "part", EJobKind.SLICE, Paths.get("/out/part.gcode"));
        Job print = create("dev1");

        // When
        queue.advance(slice.getId(), JobState.SLICING, null);
        queue.advance(slice.getId(), JobState.COMPLETED, null);

        // Then
        JobSnapshot snapshot = queue.snapshot(slice.getId()).orElseThrow();
        assertThat(snapshot.state()).isEqualTo(JobState.COMPLETED);
        assertThat(snapshot.deviceId()).isNull();
        assertThat(snapshot.position()).isNull();
        assertThat(queue.snapshot(print.getId()).orElseThrow().position()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should only start device jobs through their lane")
    void shouldRefuseDirectPrintingForDeviceJobs() {
        // Given
        Job print = create("dev1");
        toQueued(print);
        Job toFile = queue.create(Paths.get("/models/part.stl"), SlicerProfile.dummy("s"), DriverProfile.dummy("d", 0),
                null, SlicingSettings.defaults(), "part", EJobKind.PRINT_TO_FILE, null);
        toQueued(toFile);

        // When & Then
        assertThatThrownBy(() -> queue.advance(print.getId(), JobState.PRINTING, null))
                .isInstanceOf(IllegalTransitionException.class);
        assertThat(queue.advance(toFile.getId(), JobState.PRINTING, null)).isTrue();
        assertThat(queue.startNext(dev1)).map(Job::getId).contains(print.getId());
    }
}
