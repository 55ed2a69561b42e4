package conveyor.domain.device;

/**
 * Unknown device identifier
 */
public class DeviceNotFoundException extends Exception {
    private final String deviceId;

    public DeviceNotFoundException(String deviceId) {
        super("Device '" + deviceId + "' is not configured");
        this.deviceId = deviceId;
    }

    public String getDeviceId() {
        return deviceId;
    }
}
