package conveyor.domain.gateway;

import conveyor.common.EJobKind;
import conveyor.common.EProfileKind;
import conveyor.dal.SlicingSettings;
import conveyor.domain.SSEManager;
import conveyor.domain.job.CancelResult;
import conveyor.domain.job.InvalidModelException;
import conveyor.domain.job.JobFilter;
import conveyor.domain.job.JobOrchestrator;
import conveyor.domain.job.JobRequest;
import conveyor.domain.job.JobState;
import conveyor.domain.profile.ProfileNotFoundException;
import io.javalin.http.Context;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for JobController request handling
 * @since 18/10/2025
 */
@ExtendWith(MockitoExtension.class)
class JobControllerTest {

    private static final Path WORK_DIR = Paths.get("/srv/conveyor").toAbsolutePath();

    @Mock
    private JobOrchestrator orchestrator;

    @Mock
    private SSEManager sseManager;

    @Mock
    private Context ctx;

    private JobController controller;

    @BeforeEach
    void setUp() {
        controller = new JobController(orchestrator, sseManager, SlicingSettings.defaults(), WORK_DIR);
    }

    private ApiResponse<?> capturedResponse() {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(ctx).json(captor.capture());
        return (ApiResponse<?>) captor.getValue();
    }

    @Test
    @DisplayName("Should submit a job with the model resolved against the work directory")
    void shouldSubmitJob() throws Exception {
        // Given
        when(ctx.bodyAsClass(SubmitJobRequest.class)).thenReturn(new SubmitJobRequest("models/cube.stl", "skein", null, "dev1"));
        when(ctx.status(anyInt())).thenReturn(ctx);
        when(orchestrator.submit(any(JobRequest.class))).thenReturn("job-1");
        when(orchestrator.status("job-1")).thenReturn(Optional.empty());

        // When
        controller.submitJob(ctx);

        // Then
        ArgumentCaptor<JobRequest> request = ArgumentCaptor.forClass(JobRequest.class);
        verify(orchestrator).submit(request.capture());
        assertThat(request.getValue().modelPath()).isEqualTo(WORK_DIR.resolve("models/cube.stl"));
        assertThat(request.getValue().slicerProfile()).isEqualTo("skein");
        assertThat(request.getValue().driverProfile()).isNull();
        assertThat(request.getValue().deviceId()).isEqualTo("dev1");
        assertThat(request.getValue().settings()).isNull();
        assertThat(request.getValue().kind()).isEqualTo(EJobKind.PRINT);

        verify(ctx).status(201);
        assertThat(capturedResponse().isSuccess()).isTrue();
    }

    @Test
    @DisplayName("Should reject a submission without model with 400")
    void shouldRejectMissingModel() throws Exception {
        // Given
        when(ctx.bodyAsClass(SubmitJobRequest.class)).thenReturn(new SubmitJobRequest());
        when(ctx.status(anyInt())).thenReturn(ctx);

        // When
        controller.submitJob(ctx);

        // Then
        verify(ctx).status(400);
        verify(orchestrator, never()).submit(any(JobRequest.class));
        assertThat(capturedResponse().getMessage()).isEqualTo("Model path is required");
    }

    @Test
    @DisplayName("Should reject out-of-range slicing overrides with 400")
    void shouldRejectInvalidSettings() throws Exception {
        // Given
        SubmitJobRequest body = new SubmitJobRequest("cube.stl", null, null, null);
        body.setSettings(new SubmitJobRequest.Settings(true, 1.5, null));
        when(ctx.bodyAsClass(SubmitJobRequest.class)).thenReturn(body);
        when(ctx.status(anyInt())).thenReturn(ctx);

        // When
        controller.submitJob(ctx);

        // Then
        verify(ctx).status(400);
        verify(orchestrator, never()).submit(any(JobRequest.class));
        assertThat(capturedResponse().getMessage()).startsWith("Invalid slicing settings");
    }

    @Test
    @DisplayName("Should pass job kind and resolved output file to the orchestrator")
    void shouldSubmitSliceJob() throws Exception {
        // Given
        SubmitJobRequest body = new SubmitJobRequest("cube.stl", null, null, null);
        body.setKind("Print-To-File");
        body.setOutput("out/cube.x3g");
        when(ctx.bodyAsClass(SubmitJobRequest.class)).thenReturn(body);
        when(ctx.status(anyInt())).thenReturn(ctx);
        when(orchestrator.submit(any(JobRequest.class))).thenReturn("job-2");
        when(orchestrator.status("job-2")).thenReturn(Optional.empty());

        // When
        controller.submitJob(ctx);

        // Then
        ArgumentCaptor<JobRequest> request = ArgumentCaptor.forClass(JobRequest.class);
        verify(orchestrator).submit(request.capture());
        assertThat(request.getValue().kind()).isEqualTo(EJobKind.PRINT_TO_FILE);
        assertThat(request.getValue().outputPath()).isEqualTo(WORK_DIR.resolve("out/cube.x3g"));
        verify(ctx).status(201);
    }

    @Test
    @DisplayName("Should reject an unknown job kind with 400")
    void shouldRejectUnknownKind() throws Exception {
        // Given
        SubmitJobRequest body = new SubmitJobRequest("cube.stl", null, null, null);
        body.setKind("dualstrusion");
        when(ctx.bodyAsClass(SubmitJobRequest.class)).thenReturn(body);
        when(ctx.status(anyInt())).thenReturn(ctx);

        // When
        controller.submitJob(ctx);

        // Then
        verify(ctx).status(400);
        verify(orchestrator, never()).submit(any(JobRequest.class));
        assertThat(capturedResponse().getMessage()).isEqualTo("Unknown job kind: dualstrusion");
    }

    @Test
    @DisplayName("Should map unknown profile to 404")
    void shouldMapUnknownProfileToNotFound() throws Exception {
        // Given
        when(ctx.bodyAsClass(SubmitJobRequest.class)).thenReturn(new SubmitJobRequest("cube.stl", "nope", null, null));
        when(ctx.status(anyInt())).thenReturn(ctx);
        when(orchestrator.submit(any(JobRequest.class))).thenThrow(new ProfileNotFoundException(EProfileKind.SLICER, "nope"));

        // When
        controller.submitJob(ctx);

        // Then
        verify(ctx).status(404);
        assertThat(capturedResponse().isSuccess()).isFalse();
    }

    @Test
    @DisplayName("Should map invalid model to 400")
    void shouldMapInvalidModelToBadRequest() throws Exception {
        // Given
        when(ctx.bodyAsClass(SubmitJobRequest.class)).thenReturn(new SubmitJobRequest("cube.obj", null, null, null));
        when(ctx.status(anyInt())).thenReturn(ctx);
        when(orchestrator.submit(any(JobRequest.class))).thenThrow(new InvalidModelException("Unsupported model format: cube.obj"));

        // When
        controller.submitJob(ctx);

        // Then
        verify(ctx).status(400);
        assertThat(capturedResponse().getMessage()).contains("cube.obj");
    }

    @Test
    @DisplayName("Should return 404 for an unknown job")
    void shouldReturnNotFoundForUnknownJob() {
        // Given
        when(ctx.pathParam("id")).thenReturn("job-9");
        when(ctx.status(anyInt())).thenReturn(ctx);
        when(orchestrator.status("job-9")).thenReturn(Optional.empty());

        // When
        controller.getJob(ctx);

        // Then
        verify(ctx).status(404);
        assertThat(capturedResponse().getMessage()).isEqualTo("Job not found: job-9");
    }

    @Test
    @DisplayName("Should answer 409 when cancelling a terminal job")
    void shouldReturnConflictForTerminalJob() {
        // Given
        when(ctx.pathParam("id")).thenReturn("job-1");
        when(ctx.status(anyInt())).thenReturn(ctx);
        when(orchestrator.cancel("job-1")).thenReturn(CancelResult.ALREADY_TERMINAL);
        when(orchestrator.status("job-1")).thenReturn(Optional.empty());

        // When
        controller.cancelJob(ctx);

        // Then
        verify(ctx).status(409);
        assertThat(capturedResponse().isSuccess()).isFalse();
    }

    @Test
    @DisplayName("Should accept a cancel request")
    void shouldAcceptCancel() {
        // Given
        when(ctx.pathParam("id")).thenReturn("job-1");
        when(orchestrator.cancel("job-1")).thenReturn(CancelResult.OK);
        when(orchestrator.status("job-1")).thenReturn(Optional.empty());

        // When
        controller.cancelJob(ctx);

        // Then
        verify(ctx, never()).status(anyInt());
        assertThat(capturedResponse().getMessage()).isEqualTo("Cancel requested");
    }

    @Test
    @DisplayName("Should pass list filters to the orchestrator")
    void shouldFilterJobList() {
        // Given
        when(ctx.queryParam("state")).thenReturn("printing, queued");
        when(ctx.queryParam("device")).thenReturn("dev1");
        when(ctx.queryParam("active")).thenReturn(null);
        when(orchestrator.list(any(JobFilter.class))).thenReturn(Collections.emptyList());

        // When
        controller.listJobs(ctx);

        // Then
        ArgumentCaptor<JobFilter> filter = ArgumentCaptor.forClass(JobFilter.class);
        verify(orchestrator).list(filter.capture());
        assertThat(filter.getValue().states()).containsExactlyInAnyOrder(JobState.PRINTING, JobState.QUEUED);
        assertThat(filter.getValue().deviceId()).isEqualTo("dev1");
        assertThat(filter.getValue().active()).isNull();
    }

    @Test
    @DisplayName("Should reject unknown state filter with 400")
    void shouldRejectUnknownStateFilter() {
        // Given
        when(ctx.queryParam("state")).thenReturn("melting");
        when(ctx.status(anyInt())).thenReturn(ctx);

        // When
        controller.listJobs(ctx);

        // Then
        verify(ctx).status(400);
        assertThat(capturedResponse().getMessage()).isEqualTo("Unknown job state: melting");
    }

    @Test
    @DisplayName("Should parse state and active query values")
    void shouldParseQueryValues() {
        assertThat(JobController.parseStates(null)).isEmpty();
        assertThat(JobController.parseStates("completed,,failed"))
                .isEqualTo(EnumSet.of(JobState.COMPLETED, JobState.FAILED));
        assertThat(JobController.parseActive("TRUE")).isTrue();
        assertThat(JobController.parseActive("false")).isFalse();
        assertThat(JobController.parseActive(" ")).isNull();
        assertThatThrownBy(() -> JobController.parseActive("yes"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
