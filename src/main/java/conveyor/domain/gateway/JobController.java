package conveyor.domain.gateway;

import com.google.gson.JsonParseException;
import conveyor.dal.DriverProfile;
import conveyor.dal.SlicerProfile;
import conveyor.dal.SlicingSettings;
import conveyor.domain.SSEClient;
import conveyor.domain.SSEManager;
import conveyor.domain.device.DeviceNotFoundException;
import conveyor.domain.device.DeviceStatus;
import conveyor.domain.job.CancelResult;
import conveyor.domain.job.InvalidModelException;
import conveyor.domain.job.JobFilter;
import conveyor.domain.job.JobOrchestrator;
import conveyor.domain.job.JobSnapshot;
import conveyor.domain.job.JobState;
import conveyor.domain.profile.ProfileNotFoundException;
import conveyor.domain.profile.ProfileRegistry;
import io.javalin.http.Context;
import io.javalin.http.sse.SseClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static io.javalin.apibuilder.ApiBuilder.get;
import static io.javalin.apibuilder.ApiBuilder.path;
import static io.javalin.apibuilder.ApiBuilder.post;
import static io.javalin.apibuilder.ApiBuilder.sse;

/**
 * REST and SSE endpoints of the job orchestrator
 * @since 18/10/2025
 */
public class JobController {
    private static final Logger logger = LoggerFactory.getLogger(JobController.class);

    private final JobOrchestrator orchestrator;
    private final SSEManager sseManager;
    private final SlicingSettings defaultSettings;
    private final Path workDir;

    public JobController(JobOrchestrator orchestrator, SSEManager sseManager, SlicingSettings defaultSettings, Path workDir) {
        this.orchestrator = orchestrator;
        this.sseManager = sseManager;
        this.defaultSettings = defaultSettings;
        this.workDir = workDir;
    }

    /**
     * Register all REST API routes
     */
    public void registerRoutes() {
        path("/api", () -> {
            path("/jobs", () -> {
                post(this::submitJob);
                get(this::listJobs);
                path("/{id}", () -> {
                    get(this::getJob);
                    post("/cancel", this::cancelJob);
                });
            });
            get("/profiles", this::listProfiles);
            path("/devices", () -> {
                get(this::listDevices);
                post("/{id}/reconnect", this::reconnectDevice);
            });
            get("/health", this::healthCheck);
        });

        path("/api/events", () -> {
            sse("/jobs", this::sseJobEvents);
        });
    }

    /**
     * Submit a new job
     */
    void submitJob(Context ctx) {
        try {
            SubmitJobRequest request = ctx.bodyAsClass(SubmitJobRequest.class);
            if (request == null) {
                ctx.status(400).json(ApiResponse.error("Request body is required"));
                return;
            }

            String jobId = orchestrator.submit(request.toJobRequest(workDir, defaultSettings));
            Optional<JobSnapshot> snapshot = orchestrator.status(jobId);
            ctx.status(201).json(ApiResponse.success("Job submitted", snapshot.orElse(null)));

        } catch (ProfileNotFoundException | DeviceNotFoundException e) {
            ctx.status(404).json(ApiResponse.error(e.getMessage()));
        } catch (InvalidModelException | IllegalArgumentException | JsonParseException e) {
            ctx.status(400).json(ApiResponse.error(e.getMessage()));
        } catch (IllegalStateException e) {
            ctx.status(503).json(ApiResponse.error(e.getMessage()));
        } catch (Exception e) {
            logger.error("Error submitting job", e);
            ctx.status(500).json(ApiResponse.error("Submit failed: " + e.getMessage()));
        }
    }

    /**
     * List jobs, optionally filtered by {@code state}, {@code device} and {@code active}
     */
    void listJobs(Context ctx) {
        try {
            JobFilter filter = new JobFilter(parseStates(ctx.queryParam("state")), ctx.queryParam("device"),
                    parseActive(ctx.queryParam("active")));
            ctx.json(ApiResponse.success(orchestrator.list(filter)));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(ApiResponse.error(e.getMessage()));
        } catch (Exception e) {
            logger.error("Error listing jobs", e);
            ctx.status(500).json(ApiResponse.error("Failed to list jobs: " + e.getMessage()));
        }
    }

    /**
     * Get job status
     */
    void getJob(Context ctx) {
        String jobId = ctx.pathParam("id");
        Optional<JobSnapshot> snapshot = orchestrator.status(jobId);
        if (snapshot.isPresent()) {
            ctx.json(ApiResponse.success(snapshot.get()));
        } else {
            ctx.status(404).json(ApiResponse.error("Job not found: " + jobId));
        }
    }

    /**
     * Cancel a job
     */
    void cancelJob(Context ctx) {
        String jobId = ctx.pathParam("id");
        try {
            CancelResult result = orchestrator.cancel(jobId);
            switch (result) {
                case OK:
                    ctx.json(ApiResponse.success("Cancel requested", orchestrator.status(jobId).orElse(null)));
                    break;
                case NOT_FOUND:
                    ctx.status(404).json(ApiResponse.error("Job not found: " + jobId));
                    break;
                case ALREADY_TERMINAL:
                    ctx.status(409).json(new ApiResponse<>(false, "Job already terminal", orchestrator.status(jobId).orElse(null)));
                    break;
                default:
                    ctx.status(500).json(ApiResponse.error("Unexpected cancel result: " + result));
            }
        } catch (Exception e) {
            logger.error("Error cancelling job {}", jobId, e);
            ctx.status(500).json(ApiResponse.error("Cancel failed: " + e.getMessage()));
        }
    }

    /**
     * List slicer and driver profiles
     */
    void listProfiles(Context ctx) {
        ProfileRegistry registry = orchestrator.profiles();
        List<ProfileInfo> profiles = new ArrayList<>();
        for (SlicerProfile profile : registry.slicerProfiles()) {
            profiles.add(ProfileInfo.of(profile, registry.getDefaultSlicer()));
        }
        for (DriverProfile profile : registry.driverProfiles()) {
            profiles.add(ProfileInfo.of(profile, registry.getDefaultDriver()));
        }
        ctx.json(ApiResponse.success(profiles));
    }

    /**
     * List devices with their connection state
     */
    void listDevices(Context ctx) {
        ctx.json(ApiResponse.success(orchestrator.devices()));
    }

    /**
     * Re-attach a device after a disconnection
     */
    void reconnectDevice(Context ctx) {
        String deviceId = ctx.pathParam("id");
        try {
            orchestrator.reattach(deviceId);
            ctx.json(ApiResponse.success("Device re-attached", deviceStatus(deviceId)));
        } catch (DeviceNotFoundException e) {
            ctx.status(404).json(ApiResponse.error(e.getMessage()));
        } catch (Exception e) {
            logger.error("Error re-attaching device {}", deviceId, e);
            ctx.status(500).json(ApiResponse.error("Reconnect failed: " + e.getMessage()));
        }
    }

    /**
     * Health check endpoint
     */
    void healthCheck(Context ctx) {
        List<DeviceStatus> devices = orchestrator.devices();
        int attached = (int) devices.stream().filter(DeviceStatus::attached).count();
        HealthStatus health = new HealthStatus(
                attached == devices.size() ? "UP" : "DEGRADED",
                orchestrator.activeJobCount(),
                devices.size(),
                attached,
                sseManager.getClientCount(),
                ManagementFactory.getRuntimeMXBean().getUptime());
        ctx.json(ApiResponse.success(attached == devices.size() ? "Conveyor is healthy" : "Some devices are detached", health));
    }

    /**
     * Server-Sent Events for job state changes and progress, optionally limited by {@code ?jobId=}
     */
    void sseJobEvents(SseClient client) {
        String clientId = "jobs_" + UUID.randomUUID();
        String jobFilter = client.ctx().queryParam("jobId");

        SSEClient wrappedClient = new SSEClient(clientId, client, jobFilter);
        if (!sseManager.register(wrappedClient)) {
            logger.warn("Maximum SSE client limit reached, rejecting job event connection");
            client.sendEvent("error", "Maximum number of SSE clients reached");
            client.close();
            return;
        }

        client.onClose(() -> {
            logger.info("Job SSE client {} closed", clientId);
            sseManager.unregister(clientId);
        });

        client.keepAlive();
    }

    private DeviceStatus deviceStatus(String deviceId) {
        return orchestrator.devices().stream().filter(d -> d.id().equals(deviceId)).findFirst().orElse(null);
    }

    static Set<JobState> parseStates(String value) {
        Set<JobState> states = EnumSet.noneOf(JobState.class);
        if (value == null || value.trim().isEmpty()) {
            return states;
        }
        for (String item : value.split(",")) {
            if (item.trim().isEmpty()) {
                continue;
            }
            try {
                states.add(JobState.valueOf(item.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown job state: " + item.trim());
            }
        }
        return states;
    }

    static Boolean parseActive(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        if ("true".equalsIgnoreCase(value.trim())) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(value.trim())) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Parameter 'active' must be true or false");
    }
}
