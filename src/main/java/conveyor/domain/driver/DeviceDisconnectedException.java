package conveyor.domain.driver;

/**
 * Connection to the printer was lost during a print. Fatal to the job: a partially
 * printed job is never resumed automatically.
 */
public class DeviceDisconnectedException extends Exception {
    private final String deviceId;

    public DeviceDisconnectedException(String deviceId, String message) {
        super(message);
        this.deviceId = deviceId;
    }

    public String getDeviceId() {
        return deviceId;
    }
}
