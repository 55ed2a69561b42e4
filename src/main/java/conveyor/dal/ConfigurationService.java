package conveyor.dal;

import conveyor.common.BackendConstants;
import conveyor.common.EDriverBackend;
import conveyor.common.ESlicerBackend;
import conveyor.common.ServerConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Main configuration service - entry point for all configuration needs
 * @since 26/09/2025
 */
public class ConfigurationService {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationService.class);

    public static final String DEFAULT_SLICER_PROFILE = "dummy";
    public static final String DEFAULT_DRIVER_PROFILE = "dummy";
    public static final String DEFAULT_DEVICE = "dev1";

    private final ConfigurationLoader loader;
    private ServerConfig serverConfig;
    private SlicingSettings slicingSettings;
    private Map<String, SlicerProfile> slicerProfiles;
    private Map<String, DriverProfile> driverProfiles;
    private String defaultSlicer;
    private String defaultDriver;
    private List<DeviceConfig> devices;

    public ConfigurationService() throws ConfigurationException {
        this(new ConfigurationLoader());
    }

    public ConfigurationService(ConfigurationLoader loader) throws ConfigurationException {
        this.loader = loader;
        load();
    }

    private void load() throws ConfigurationException {
        this.serverConfig = loadServerConfiguration();
        this.slicingSettings = loadSlicingSettings();
        this.slicerProfiles = loadSlicerProfiles(serverConfig.workDir());
        this.driverProfiles = loadDriverProfiles(serverConfig.workDir());
        this.defaultSlicer = loadDefaultName("slicer.default", slicerProfiles);
        this.defaultDriver = loadDefaultName("driver.default", driverProfiles);
        this.devices = loadDevices();
    }

    /**
     * Load server configuration
     */
    private ServerConfig loadServerConfiguration() throws ConfigurationException {
        ServiceAddress address = ServiceAddress.parse(loader.getString("server.address", ServerConstants.SERVER_ADDRESS));
        Path workDir = Paths.get(loader.getString("server.work.dir", System.getProperty("user.dir"))).toAbsolutePath().normalize();
        Path pidFile = resolve(workDir, loader.getString("server.pid.file", ServerConstants.PID_FILE));
        int eventThreads = loader.getInt("server.event.threads", ServerConstants.EVENT_THREADS);
        int requestThreads = loader.getInt("server.request.threads", ServerConstants.REQUEST_THREADS);
        boolean loggingEnabled = loader.getBoolean("server.logging.enabled", true);
        String loggingLevel = loader.getString("server.logging.level", "INFO");
        String loggingFile = loader.getString("server.logging.file", null);
        int scanInterval = loader.getInt("server.device.scan.interval", ServerConstants.DEVICE_SCAN_INTERVAL_MS);

        // Load startup mode
        String modeStr = loader.getString("server.startup.mode", "LENIENT");
        StartupMode startupMode;
        try {
            startupMode = StartupMode.valueOf(modeStr.toUpperCase());
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid startup mode '{}', using LENIENT", modeStr);
            startupMode = StartupMode.LENIENT;
        }

        ServerConfig config = new ServerConfig(address, pidFile, eventThreads, requestThreads, startupMode,
                loggingEnabled, loggingLevel, loggingFile, scanInterval, workDir);
        config.validate();
        return config;
    }

    /**
     * Load client slicing defaults
     */
    private SlicingSettings loadSlicingSettings() throws ConfigurationException {
        SlicingSettings defaults = SlicingSettings.defaults();
        SlicingSettings settings = new SlicingSettings(
                loader.getBoolean("slicing.raft", defaults.raft()),
                loader.getBoolean("slicing.support", defaults.support()),
                loader.getDouble("slicing.infill", defaults.infill()),
                loader.getDouble("slicing.layer.height", defaults.layerHeight()),
                loader.getInt("slicing.shells", defaults.shells()),
                loader.getInt("slicing.extruder.temperature", defaults.extruderTemperature()),
                loader.getInt("slicing.platform.temperature", defaults.platformTemperature()),
                loader.getInt("slicing.print.speed", defaults.printSpeed()),
                loader.getInt("slicing.travel.speed", defaults.travelSpeed()));
        settings.validate();
        return settings;
    }

    /**
     * Load slicer profiles, a single dummy profile is registered when none is configured
     */
    private Map<String, SlicerProfile> loadSlicerProfiles(Path workDir) throws ConfigurationException {
        Map<String, SlicerProfile> profiles = new LinkedHashMap<>();
        List<String> names = loader.getList("slicer.profiles");

        if (names.isEmpty()) {
            logger.info("No slicer profiles configured, registering DUMMY profile '{}'", DEFAULT_SLICER_PROFILE);
            profiles.put(DEFAULT_SLICER_PROFILE, SlicerProfile.dummy(DEFAULT_SLICER_PROFILE));
            return profiles;
        }

        for (String name : names) {
            String prefix = "slicer." + name + ".";
            ESlicerBackend backend = parseBackend(ESlicerBackend.class, loader.getRequiredString(prefix + "backend"), prefix + "backend");

            SlicerProfile profile = new SlicerProfile(
                    name,
                    backend,
                    resolveOptional(workDir, loader.getString(prefix + "executable", null)),
                    resolveOptional(workDir, loader.getString(prefix + "config", null)),
                    loader.getString(prefix + "interpreter",
                            backend == ESlicerBackend.SKEINFORGE ? BackendConstants.SKEINFORGE_INTERPRETER : null),
                    resolveOptional(workDir, loader.getString(prefix + "start.gcode", null)),
                    resolveOptional(workDir, loader.getString(prefix + "end.gcode", null)),
                    loader.getLong(prefix + "timeout", BackendConstants.SLICER_TIMEOUT_MS));
            profile.validate();

            if (profiles.put(name, profile) != null) {
                throw new ConfigurationException("Duplicate slicer profile '" + name + "'");
            }
            logger.info("Configured {} slicer profile '{}'", backend, name);
        }
        return profiles;
    }

    /**
     * Load driver profiles, a single dummy profile is registered when none is configured
     */
    private Map<String, DriverProfile> loadDriverProfiles(Path workDir) throws ConfigurationException {
        Map<String, DriverProfile> profiles = new LinkedHashMap<>();
        List<String> names = loader.getList("driver.profiles");

        if (names.isEmpty()) {
            logger.info("No driver profiles configured, registering DUMMY profile '{}'", DEFAULT_DRIVER_PROFILE);
            profiles.put(DEFAULT_DRIVER_PROFILE,
                    DriverProfile.dummy(DEFAULT_DRIVER_PROFILE, BackendConstants.DUMMY_LINE_DELAY_MS));
            return profiles;
        }

        for (String name : names) {
            String prefix = "driver." + name + ".";
            EDriverBackend backend = parseBackend(EDriverBackend.class, loader.getRequiredString(prefix + "backend"), prefix + "backend");

            DriverProfile profile = new DriverProfile(
                    name,
                    backend,
                    resolveOptional(workDir, loader.getString(prefix + "executable", null)),
                    resolveOptional(workDir, loader.getString(prefix + "profile.dir", null)),
                    loader.getString(prefix + "machine", "Replicator2"),
                    loader.getLong(prefix + "line.delay", BackendConstants.DUMMY_LINE_DELAY_MS),
                    loader.getLong(prefix + "abort.grace", BackendConstants.ABORT_GRACE_MS));
            profile.validate();

            if (profiles.put(name, profile) != null) {
                throw new ConfigurationException("Duplicate driver profile '" + name + "'");
            }
            logger.info("Configured {} driver profile '{}' (machine={})", backend, name, profile.machine());
        }
        return profiles;
    }

    /**
     * Load device list, a single virtual device is registered when none is configured
     */
    private List<DeviceConfig> loadDevices() throws ConfigurationException {
        List<String> ids = loader.getList("devices");
        if (ids.isEmpty()) {
            logger.info("No devices configured, registering virtual device '{}'", DEFAULT_DEVICE);
            return Collections.singletonList(DeviceConfig.virtual(DEFAULT_DEVICE));
        }

        List<DeviceConfig> result = new ArrayList<>();
        for (String id : ids) {
            String prefix = "device." + id + ".";
            DeviceConfig device = new DeviceConfig(id,
                    loader.getString(prefix + "name", id),
                    loader.getString(prefix + "port", null));
            device.validate();
            if (result.stream().anyMatch(d -> d.id().equals(id))) {
                throw new ConfigurationException("Duplicate device '" + id + "'");
            }
            result.add(device);
            logger.info("Configured device '{}' ({})", id, device.isVirtual() ? "virtual" : device.port());
        }
        return Collections.unmodifiableList(result);
    }

    private String loadDefaultName(String key, Map<String, ? extends Profile> profiles) throws ConfigurationException {
        String name = loader.getString(key, null);
        if (name == null || name.trim().isEmpty()) {
            return profiles.keySet().iterator().next();
        }
        if (!profiles.containsKey(name)) {
            throw new ConfigurationException("Default profile '" + name + "' (" + key + ") is not configured");
        }
        return name;
    }

    private static <E extends Enum<E>> E parseBackend(Class<E> type, String value, String key) throws ConfigurationException {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid backend '" + value + "' for property '" + key + "'", e);
        }
    }

    private static Path resolve(Path workDir, String value) {
        return workDir.resolve(value).normalize();
    }

    private static Path resolveOptional(Path workDir, String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return resolve(workDir, value.trim());
    }

    /**
     * Get server configuration
     */
    public ServerConfig getServerConfiguration() {
        return serverConfig;
    }

    /**
     * Get default slicing settings
     */
    public SlicingSettings getSlicingSettings() {
        return slicingSettings;
    }

    /**
     * Get slicer profiles in declaration order
     */
    public Map<String, SlicerProfile> getSlicerProfiles() {
        return Collections.unmodifiableMap(slicerProfiles);
    }

    /**
     * Get driver profiles in declaration order
     */
    public Map<String, DriverProfile> getDriverProfiles() {
        return Collections.unmodifiableMap(driverProfiles);
    }

    public String getDefaultSlicerProfile() {
        return defaultSlicer;
    }

    public String getDefaultDriverProfile() {
        return defaultDriver;
    }

    /**
     * Get configured devices
     */
    public List<DeviceConfig> getDevices() {
        return devices;
    }

    /**
     * Reload configuration
     */
    public void reload() throws ConfigurationException {
        logger.info("Reloading configuration...");
        loader.reload();
        load();

        logger.info("Configuration reloaded successfully");
        logger.info("Server: {}", serverConfig);
        logger.info("Slicer profiles: {}", slicerProfiles.keySet());
        logger.info("Driver profiles: {}", driverProfiles.keySet());
        logger.info("Devices: {}", devices);
    }
}
