package conveyor.domain.slicer;

import conveyor.dal.SlicerProfile;
import conveyor.dal.SlicingSettings;

import java.nio.file.Path;

/**
 * Input of one slicer invocation
 *
 * @param modelPath model to slice
 * @param outputPath where the toolpath must end up
 * @param profile resolved slicer profile
 * @param settings effective slicing settings
 */
public record SliceRequest(Path modelPath, Path outputPath, SlicerProfile profile, SlicingSettings settings) {

    /**
     * Per-job scratch directory, the directory of the output file
     */
    public Path workDir() {
        return outputPath.toAbsolutePath().getParent();
    }
}
