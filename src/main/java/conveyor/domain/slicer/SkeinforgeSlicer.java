package conveyor.domain.slicer;

import conveyor.common.BackendConstants;
import conveyor.dal.SlicerProfile;
import conveyor.dal.SlicingSettings;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Skeinforge slicer.
 * <p>Skeinforge writes {@code <model>_export.gcode} next to its input, so the model is copied into
 * the job directory first and the export is moved to the requested output afterwards.</p>
 *
 * @since 17/10/2025
 */
public class SkeinforgeSlicer extends AbstractProcessSlicer {

    @Override
    protected String getBackendName() {
        return "Skeinforge";
    }

    @Override
    protected List<String> buildCommand(SliceRequest request) throws IOException {
        SlicerProfile profile = request.profile();
        Path input = request.workDir().resolve(request.modelPath().getFileName());
        if (!input.equals(request.modelPath().toAbsolutePath())) {
            Files.copy(request.modelPath(), input, StandardCopyOption.REPLACE_EXISTING);
        }

        List<String> command = new ArrayList<>();
        if (profile.interpreter() != null && !profile.interpreter().isEmpty()) {
            command.add(profile.interpreter());
        }
        command.add(profile.executable().toString());
        if (profile.configPath() != null) {
            command.add("-p");
            command.add(profile.configPath().toString());
        }
        for (String option : options(request.settings())) {
            command.add("--option");
            command.add(option);
        }
        command.add(input.toString());
        return command;
    }

    @Override
    protected Path collectOutput(SliceRequest request) throws IOException {
        Path export = exportPath(request);
        if (!Files.isRegularFile(export)) {
            return request.outputPath();
        }
        return Files.move(export, request.outputPath(), StandardCopyOption.REPLACE_EXISTING);
    }

    static Path exportPath(SliceRequest request) {
        String name = request.modelPath().getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return request.workDir().resolve(stem + BackendConstants.SKEINFORGE_EXPORT_SUFFIX);
    }

    static List<String> options(SlicingSettings settings) {
        List<String> options = new ArrayList<>();
        options.add("raft.csv:Add Raft, Elevate Nozzle, Orbit:" + settings.raft());
        options.add("raft.csv:None:" + !settings.support());
        options.add("raft.csv:Exterior Only:" + settings.support());
        options.add("fill.csv:Infill Solidity (ratio):" + settings.infill());
        options.add("fill.csv:Extra Shells on Sparse Layer (layers):" + settings.shells());
        options.add("carve.csv:Layer Height (mm):" + settings.layerHeight());
        options.add("speed.csv:Feed Rate (mm/s):" + settings.printSpeed());
        options.add("speed.csv:Travel Feed Rate (mm/s):" + settings.travelSpeed());
        options.add("temperature.csv:Base Temperature (Celcius):" + settings.extruderTemperature());
        return options;
    }
}
