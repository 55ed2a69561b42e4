package conveyor.common;

/**
 * Supported printer driver backends
 * @since 14/10/2025
 */
public enum EDriverBackend {
    MAKERBOT,   // External MakerBot driver process bound to a serial port
    DUMMY       // Simulated printer (no physical hardware)
}
