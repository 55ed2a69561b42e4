package conveyor.domain.slicer;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import conveyor.dal.SlicerProfile;
import conveyor.dal.SlicingSettings;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Miracle Grue slicer.
 * <p>Writes a per-job JSON configuration (the profile's base configuration overlaid with the
 * job's settings) plus start and end G-code files, then runs
 * {@code <exe> -c <config> -o <out> -s <start> -e <end> <model>}.</p>
 *
 * @since 17/10/2025
 */
public class MiracleGrueSlicer extends AbstractProcessSlicer {
    static final String CONFIG_FILE = "miracle.config";
    static final String START_FILE = "start.gcode";
    static final String END_FILE = "end.gcode";

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    @Override
    protected String getBackendName() {
        return "Miracle Grue";
    }

    @Override
    protected List<String> buildCommand(SliceRequest request) throws IOException {
        SlicerProfile profile = request.profile();
        Path workDir = request.workDir();

        Path config = workDir.resolve(CONFIG_FILE);
        Files.writeString(config, gson.toJson(buildConfig(profile.configPath(), request.settings())), StandardCharsets.UTF_8);
        Path start = copyOrCreate(profile.startGcode(), workDir.resolve(START_FILE));
        Path end = copyOrCreate(profile.endGcode(), workDir.resolve(END_FILE));

        List<String> command = new ArrayList<>();
        command.add(profile.executable().toString());
        command.add("-c");
        command.add(config.toString());
        command.add("-o");
        command.add(request.outputPath().toAbsolutePath().toString());
        command.add("-s");
        command.add(start.toString());
        command.add("-e");
        command.add(end.toString());
        command.add(request.modelPath().toAbsolutePath().toString());
        return command;
    }

    /**
     * Merge job settings into the base configuration, job settings win
     */
    JsonObject buildConfig(Path baseConfig, SlicingSettings settings) throws IOException {
        JsonObject config = new JsonObject();
        if (baseConfig != null && Files.isRegularFile(baseConfig)) {
            try (Reader reader = Files.newBufferedReader(baseConfig, StandardCharsets.UTF_8)) {
                config = JsonParser.parseReader(reader).getAsJsonObject();
            }
        }
        config.addProperty("doRaft", settings.raft());
        config.addProperty("doSupport", settings.support());
        config.addProperty("infillDensity", settings.infill());
        config.addProperty("layerHeight", settings.layerHeight());
        config.addProperty("numberOfShells", settings.shells());
        config.addProperty("extruderTemp", settings.extruderTemperature());
        config.addProperty("platformTemp", settings.platformTemperature());
        config.addProperty("feedrate", settings.printSpeed());
        config.addProperty("rapidMoveFeedRateXY", settings.travelSpeed());
        return config;
    }

    private static Path copyOrCreate(Path source, Path target) throws IOException {
        if (source != null && Files.isRegularFile(source)) {
            return Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return Files.writeString(target, "", StandardCharsets.UTF_8);
    }
}
