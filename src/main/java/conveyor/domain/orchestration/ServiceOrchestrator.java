package conveyor.domain.orchestration;

import conveyor.common.ESlicerBackend;
import conveyor.common.EDriverBackend;
import conveyor.dal.DriverProfile;
import conveyor.dal.ServiceAddress;
import conveyor.dal.SlicerProfile;
import conveyor.dal.StartupMode;
import conveyor.domain.ServiceInitializationResult;
import conveyor.domain.StartupException;
import conveyor.domain.device.DeviceHandle;
import conveyor.domain.device.DeviceManager;
import conveyor.domain.device.DeviceMonitorService;
import conveyor.domain.profile.ProfileRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Checks slicer and driver backends and devices at startup and decides whether the daemon may run
 * @since 19/10/2025
 */
public class ServiceOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(ServiceOrchestrator.class);

    public static final String SLICER = "slicer";
    public static final String DRIVER = "driver";
    public static final String DEVICE = "device";

    private final ProfileRegistry profiles;
    private final DeviceManager deviceManager;
    private final DeviceMonitorService deviceMonitor;

    private final Map<String, ServiceInitializationResult> initializationResults = new LinkedHashMap<>();

    public ServiceOrchestrator(ProfileRegistry profiles, DeviceManager deviceManager, DeviceMonitorService deviceMonitor) {
        this.profiles = profiles;
        this.deviceManager = deviceManager;
        this.deviceMonitor = deviceMonitor;
    }

    /**
     * Check every configured profile and device
     * @return list of results in check order
     */
    public List<ServiceInitializationResult> initializeAllServices() {
        List<ServiceInitializationResult> results = new ArrayList<>();
        initializationResults.clear();

        for (SlicerProfile profile : profiles.slicerProfiles()) {
            results.add(record(initializeSlicer(profile)));
        }
        for (DriverProfile profile : profiles.driverProfiles()) {
            results.add(record(initializeDriver(profile)));
        }

        // Initial scan so port-backed devices report their real state
        if (deviceManager.getHandles().stream().anyMatch(h -> !h.getConfig().isVirtual())) {
            deviceMonitor.scan();
        }
        for (DeviceHandle handle : deviceManager.getHandles()) {
            results.add(record(initializeDevice(handle)));
        }

        return results;
    }

    private ServiceInitializationResult record(ServiceInitializationResult result) {
        initializationResults.put(result.getCategory() + ":" + result.getServiceName(), result);
        return result;
    }

    /**
     * Check a slicer profile: its executable and configuration must be present
     */
    ServiceInitializationResult initializeSlicer(SlicerProfile profile) {
        long startTime = System.currentTimeMillis();
        logger.info("Checking slicer profile '{}' ({})...", profile.name(), profile.backend());

        try {
            if (profile.backend() != ESlicerBackend.DUMMY) {
                boolean interpreted = profile.interpreter() != null && !profile.interpreter().trim().isEmpty();
                requireExecutable(profile.executable(), interpreted);
                if (profile.configPath() != null && !Files.exists(profile.configPath())) {
                    throw new IllegalStateException("Configuration not found: " + profile.configPath());
                }
            }
            long duration = System.currentTimeMillis() - startTime;
            logger.info("✓ Slicer profile '{}' ready ({}ms)", profile.name(), duration);
            return ServiceInitializationResult.success(profile.name(), SLICER, duration);

        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            logger.error("✗ Slicer profile '{}' unusable after {}ms: {}", profile.name(), duration, e.getMessage());
            return ServiceInitializationResult.failure(profile.name(), SLICER, e, duration);
        }
    }

    /**
     * Check a driver profile: its executable and machine profile directory must be present
     */
    ServiceInitializationResult initializeDriver(DriverProfile profile) {
        long startTime = System.currentTimeMillis();
        logger.info("Checking driver profile '{}' ({})...", profile.name(), profile.backend());

        try {
            if (profile.backend() != EDriverBackend.DUMMY) {
                requireExecutable(profile.executable(), false);
                if (profile.profileDir() != null && !Files.isDirectory(profile.profileDir())) {
                    throw new IllegalStateException("Machine profile directory not found: " + profile.profileDir());
                }
            }
            long duration = System.currentTimeMillis() - startTime;
            logger.info("✓ Driver profile '{}' ready ({}ms)", profile.name(), duration);
            return ServiceInitializationResult.success(profile.name(), DRIVER, duration);

        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            logger.error("✗ Driver profile '{}' unusable after {}ms: {}", profile.name(), duration, e.getMessage());
            return ServiceInitializationResult.failure(profile.name(), DRIVER, e, duration);
        }
    }

    ServiceInitializationResult initializeDevice(DeviceHandle handle) {
        if (handle.isAttached()) {
            logger.info("✓ Device '{}' attached", handle.getId());
            return ServiceInitializationResult.success(handle.getId(), DEVICE, 0);
        }
        logger.warn("⚠ Device '{}' not attached (port {}), waiting for it to appear", handle.getId(), handle.getConfig().port());
        return ServiceInitializationResult.failure(handle.getId(), DEVICE,
                "Port " + handle.getConfig().port() + " not present", 0);
    }

    private static void requireExecutable(Path executable, boolean interpreted) {
        if (executable == null) {
            throw new IllegalStateException("No executable configured");
        }
        if (!Files.isRegularFile(executable)) {
            throw new IllegalStateException("Executable not found: " + executable);
        }
        if (!interpreted && !Files.isExecutable(executable)) {
            throw new IllegalStateException("File is not executable: " + executable);
        }
    }

    /**
     * Evaluate if startup requirements are met based on mode.
     * <p>Only slicer and driver results count, a detached device is reported but never blocks startup.</p>
     * @param mode Startup mode
     * @param results Initialization results
     * @throws StartupException if requirements not met
     */
    public void evaluateStartupRequirements(StartupMode mode, List<ServiceInitializationResult> results) throws StartupException {
        long slicersOk = count(results, SLICER, true);
        long slicersTotal = count(results, SLICER, null);
        long driversOk = count(results, DRIVER, true);
        long driversTotal = count(results, DRIVER, null);

        logger.info("Backend check complete: {}/{} slicer profiles, {}/{} driver profiles usable",
                slicersOk, slicersTotal, driversOk, driversTotal);

        switch (mode) {
            case STRICT:
                if (slicersOk != slicersTotal || driversOk != driversTotal) {
                    String message = String.format(
                            "STRICT mode requires all backends to be usable. "
                                    + "Usable: %d/%d slicer profiles, %d/%d driver profiles.",
                            slicersOk, slicersTotal, driversOk, driversTotal);
                    throw new StartupException(message, mode, results);
                }
                logger.info("✓ STRICT mode requirement met: all backends usable");
                break;

            case LENIENT:
                if (slicersOk == 0 || driversOk == 0) {
                    String message = "LENIENT mode requires at least one usable slicer and one usable driver profile.";
                    throw new StartupException(message, mode, results);
                }
                if (slicersOk < slicersTotal || driversOk < driversTotal) {
                    logger.warn("⚠ LENIENT mode: some profiles unusable, jobs using them will fail");
                } else {
                    logger.info("✓ LENIENT mode requirement met: all backends usable");
                }
                break;

            case PERMISSIVE:
                if (slicersOk < slicersTotal || driversOk < driversTotal) {
                    logger.warn("⚠ PERMISSIVE mode: running with unusable profiles");
                } else {
                    logger.info("✓ PERMISSIVE mode: all backends usable");
                }
                break;
        }
    }

    private static long count(List<ServiceInitializationResult> results, String category, Boolean success) {
        return results.stream()
                .filter(r -> r.getCategory().equals(category))
                .filter(r -> success == null || r.isSuccess() == success)
                .count();
    }

    /**
     * Start device port monitoring
     */
    public void startMonitoring(ScheduledExecutorService executorService) {
        deviceMonitor.startMonitoring(executorService);
    }

    /**
     * Log startup summary
     */
    public void logStartupSummary(List<ServiceInitializationResult> results, ServiceAddress address) {
        logger.info("========================================");
        logger.info("Startup Complete - Daemon Status:");
        logger.info("========================================");

        for (ServiceInitializationResult result : results) {
            logger.info(result.toString());
        }

        logger.info("Web Server: RUNNING on {}", address);
        logger.info("API Documentation: http://{}:{}/docs", address.host(), address.port());
        logger.info("========================================");
    }

    /**
     * Get initialization results (for testing or status endpoints)
     * @return Map of {@code category:name} to initialization result
     */
    public Map<String, ServiceInitializationResult> getInitializationResults() {
        return Collections.unmodifiableMap(initializationResults);
    }
}
