package conveyor.domain.gateway;

import conveyor.common.EJobKind;
import conveyor.dal.ConfigurationException;
import conveyor.dal.SlicingSettings;
import conveyor.domain.job.JobRequest;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Request body of {@code POST /api/jobs}. Only {@code model} is required.
 * {@code kind} is one of {@code print} (default), {@code slice} or {@code print_to_file},
 * {@code output} names the result file of the latter two.
 */
public class SubmitJobRequest {
    private String model;
    private String slicerProfile;
    private String driverProfile;
    private String device;
    private String buildName;
    private String kind;
    private String output;
    private Settings settings;

    /**
     * Per-job slicing overrides, unset values keep the configured defaults
     */
    public static class Settings {
        private Boolean raft;
        private Boolean support;
        private Double infill;
        private Double layerHeight;
        private Integer shells;
        private Integer extruderTemperature;
        private Integer platformTemperature;
        private Integer printSpeed;
        private Integer travelSpeed;

        public Settings() {
        }

        public Settings(Boolean raft, Double infill, Double layerHeight) {
            this.raft = raft;
            this.infill = infill;
            this.layerHeight = layerHeight;
        }

        SlicingSettings mergeInto(SlicingSettings defaults) {
            return new SlicingSettings(
                    raft != null ? raft : defaults.raft(),
                    support != null ? support : defaults.support(),
                    infill != null ? infill : defaults.infill(),
                    layerHeight != null ? layerHeight : defaults.layerHeight(),
                    shells != null ? shells : defaults.shells(),
                    extruderTemperature != null ? extruderTemperature : defaults.extruderTemperature(),
                    platformTemperature != null ? platformTemperature : defaults.platformTemperature(),
                    printSpeed != null ? printSpeed : defaults.printSpeed(),
                    travelSpeed != null ? travelSpeed : defaults.travelSpeed());
        }
    }

    public SubmitJobRequest() {
    }

    public SubmitJobRequest(String model, String slicerProfile, String driverProfile, String device) {
        this.model = model;
        this.slicerProfile = slicerProfile;
        this.driverProfile = driverProfile;
        this.device = device;
    }

    /**
     * Convert to an orchestrator request
     * @param workDir base directory of relative model paths
     * @param defaults configured slicing defaults
     * @throws IllegalArgumentException if the model is missing, the kind is unknown or a setting is out of range
     */
    public JobRequest toJobRequest(Path workDir, SlicingSettings defaults) {
        if (model == null || model.trim().isEmpty()) {
            throw new IllegalArgumentException("Model path is required");
        }
        SlicingSettings effective = null;
        if (settings != null) {
            effective = settings.mergeInto(defaults);
            try {
                effective.validate();
            } catch (ConfigurationException e) {
                throw new IllegalArgumentException("Invalid slicing settings: " + e.getMessage(), e);
            }
        }
        Path outputPath = output == null || output.trim().isEmpty() ? null : workDir.resolve(Paths.get(output.trim()));
        return new JobRequest(workDir.resolve(Paths.get(model.trim())), slicerProfile, driverProfile, device, effective,
                buildName, parseKind(kind), outputPath);
    }

    private static EJobKind parseKind(String kind) {
        if (kind == null || kind.trim().isEmpty()) {
            return EJobKind.PRINT;
        }
        try {
            return EJobKind.valueOf(kind.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown job kind: " + kind, e);
        }
    }

    public String getModel() {
        return model;
    }

    public String getSlicerProfile() {
        return slicerProfile;
    }

    public String getDriverProfile() {
        return driverProfile;
    }

    public String getDevice() {
        return device;
    }

    public String getBuildName() {
        return buildName;
    }

    public void setBuildName(String buildName) {
        this.buildName = buildName;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public String getOutput() {
        return output;
    }

    public void setOutput(String output) {
        this.output = output;
    }

    public Settings getSettings() {
        return settings;
    }

    public void setSettings(Settings settings) {
        this.settings = settings;
    }
}
