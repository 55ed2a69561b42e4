package conveyor.domain.job;

import conveyor.common.EJobKind;
import conveyor.dal.SlicingSettings;

import java.nio.file.Path;

/**
 * Job request as accepted by the orchestrator
 *
 * @param modelPath model file (.stl is sliced, .gcode is printed as is)
 * @param slicerProfile slicer profile name, null selects the default profile
 * @param driverProfile driver profile name, null selects the default profile
 * @param deviceId target device, only used by print jobs
 * @param settings per-job slicing settings, null uses the configured defaults
 * @param buildName name reported to the printer, null derives it from the model file name
 * @param kind what the job produces, null means {@link EJobKind#PRINT}
 * @param outputPath result file of slice and print-to-file jobs, null writes it to the job directory
 */
public record JobRequest(Path modelPath,
                         String slicerProfile,
                         String driverProfile,
                         String deviceId,
                         SlicingSettings settings,
                         String buildName,
                         EJobKind kind,
                         Path outputPath) {

    public JobRequest {
        if (kind == null) {
            kind = EJobKind.PRINT;
        }
    }

    public static JobRequest of(Path modelPath, String slicerProfile, String driverProfile, String deviceId) {
        return new JobRequest(modelPath, slicerProfile, driverProfile, deviceId, null, null, EJobKind.PRINT, null);
    }

    /**
     * Slice a model to {@code outputPath} without printing it
     */
    public static JobRequest slice(Path modelPath, String slicerProfile, Path outputPath) {
        return new JobRequest(modelPath, slicerProfile, null, null, null, null, EJobKind.SLICE, outputPath);
    }

    /**
     * Slice a model and let the driver write the build file to {@code outputPath}
     */
    public static JobRequest printToFile(Path modelPath, String slicerProfile, String driverProfile, Path outputPath) {
        return new JobRequest(modelPath, slicerProfile, driverProfile, null, null, null, EJobKind.PRINT_TO_FILE, outputPath);
    }
}
