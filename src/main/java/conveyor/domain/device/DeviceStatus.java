package conveyor.domain.device;

/**
 * Device state as reported to clients
 *
 * @param holder id of the job currently printing on the device, null when idle
 */
public record DeviceStatus(String id, String name, String port, boolean virtual, boolean attached, String holder) {
}
