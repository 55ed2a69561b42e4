package conveyor.common;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Model file types accepted for printing
 * @since 17/10/2025
 */
public enum EModelType {
    STL(".stl"),        // sliced by the job's slicer profile
    GCODE(".gcode"),    // already a toolpath, sent to the driver as is
    ;

    private final String extension;

    EModelType(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Get model type from file extension, null when unsupported
     */
    public static EModelType fromPath(Path path) {
        if (path == null || path.getFileName() == null) {
            return null;
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (EModelType type : values()) {
            if (name.endsWith(type.extension)) {
                return type;
            }
        }
        return null;
    }
}
