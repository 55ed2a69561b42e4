package conveyor.common;

/**
 * Supported slicing backends
 * @since 14/10/2025
 */
public enum ESlicerBackend {
    MIRACLE_GRUE,   // Miracle Grue executable with JSON configuration
    SKEINFORGE,     // Skeinforge craft script run through a Python interpreter
    DUMMY           // In-process toolpath generator (no external slicer)
}
