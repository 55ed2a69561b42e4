package conveyor.domain.slicer;

import conveyor.dal.SlicingSettings;
import conveyor.domain.job.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * In-process slicer that writes a synthetic toolpath. Used in dummy mode and tests.
 */
public class DummySlicer implements ISlicer {
    private static final Logger logger = LoggerFactory.getLogger(DummySlicer.class);
    static final int LAYER_LINES = 10;

    @Override
    public Path slice(SliceRequest request, CancellationToken token) throws SliceFailedException {
        token.throwIfCancelled();
        if (!Files.isRegularFile(request.modelPath())) {
            throw new SliceFailedException("Model " + request.modelPath() + " is not readable", -1, null);
        }

        SlicingSettings settings = request.settings();
        int layers = Math.max(1, (int) Math.round(2.7 / settings.layerHeight()));
        try {
            Files.createDirectories(request.workDir());
            try (BufferedWriter writer = Files.newBufferedWriter(request.outputPath(), StandardCharsets.UTF_8)) {
                writer.write("; sliced by dummy slicer from " + request.modelPath().getFileName());
                writer.newLine();
                writer.write(String.format(Locale.ROOT, "M104 S%d", settings.extruderTemperature()));
                writer.newLine();
                writer.write(String.format(Locale.ROOT, "M140 S%d", settings.platformTemperature()));
                writer.newLine();
                for (int layer = 0; layer < layers; layer++) {
                    token.throwIfCancelled();
                    double z = (layer + 1) * settings.layerHeight();
                    writer.write(String.format(Locale.ROOT, "G1 Z%.3f F%d", z, settings.travelSpeed() * 60));
                    writer.newLine();
                    for (int i = 0; i < LAYER_LINES; i++) {
                        writer.write(String.format(Locale.ROOT, "G1 X%d Y%d F%d", i, layer, settings.printSpeed() * 60));
                        writer.newLine();
                    }
                }
                writer.write("M104 S0");
                writer.newLine();
            }
        } catch (IOException e) {
            throw new SliceFailedException("Dummy slicer could not write toolpath: " + e.getMessage(), e);
        }
        logger.info("✓ Dummy slicer produced {} ({} layers)", request.outputPath(), layers);
        return request.outputPath();
    }
}
