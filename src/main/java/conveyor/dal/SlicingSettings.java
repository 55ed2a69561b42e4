package conveyor.dal;

/**
 * Slicing parameters: client defaults from configuration, optionally overridden per job
 *
 * @since 14/10/2025
 */
public record SlicingSettings(boolean raft,
                              boolean support,
                              double infill,
                              double layerHeight,
                              int shells,
                              int extruderTemperature,
                              int platformTemperature,
                              int printSpeed,
                              int travelSpeed) {

    /**
     * Built-in defaults, used when the configuration does not name a value
     */
    public static SlicingSettings defaults() {
        return new SlicingSettings(false, false, 0.10, 0.27, 2, 230, 110, 80, 100);
    }

    /**
     * Validate value ranges
     */
    public void validate() throws ConfigurationException {
        if (infill < 0.0 || infill > 1.0) {
            throw new ConfigurationException("Infill density must be between 0 and 1");
        }
        if (layerHeight <= 0.0 || layerHeight > 1.0) {
            throw new ConfigurationException("Layer height must be in (0, 1] mm");
        }
        if (shells < 0) {
            throw new ConfigurationException("Shell count cannot be negative");
        }
        if (extruderTemperature < 0 || platformTemperature < 0) {
            throw new ConfigurationException("Temperatures cannot be negative");
        }
        if (printSpeed <= 0 || travelSpeed <= 0) {
            throw new ConfigurationException("Speeds must be positive");
        }
    }
}
