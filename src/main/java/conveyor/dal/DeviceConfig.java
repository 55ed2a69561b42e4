package conveyor.dal;

/**
 * Type-safe configuration for one printer device
 *
 * @param id device identifier used by clients
 * @param name human readable name
 * @param port serial port name, null for a virtual device
 * @since 15/10/2025
 */
public record DeviceConfig(String id, String name, String port) {

    /**
     * Factory method: device without a serial port, always attached
     */
    public static DeviceConfig virtual(String id) {
        return new DeviceConfig(id, id, null);
    }

    public boolean isVirtual() {
        return port == null;
    }

    public void validate() throws ConfigurationException {
        if (id == null || id.trim().isEmpty()) {
            throw new ConfigurationException("Device id cannot be empty");
        }
        if (port != null && port.trim().isEmpty()) {
            throw new ConfigurationException("Serial port cannot be blank for device '" + id + "'");
        }
    }
}
