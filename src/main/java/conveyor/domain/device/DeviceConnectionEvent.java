package conveyor.domain.device;

/**
 * Posted on the device event bus whenever a device is attached or detached
 */
public record DeviceConnectionEvent(String deviceId, boolean attached, String reason) {
}
