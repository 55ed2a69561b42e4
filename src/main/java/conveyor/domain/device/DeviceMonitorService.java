package conveyor.domain.device;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Background service that polls the serial ports and attaches or detaches devices
 * whose port appears or disappears. Only changes in port presence are acted on, so a device
 * detached after a mid-print disconnection stays detached until its port is re-plugged
 * or it is re-attached explicitly.
 *
 * @since 15/10/2025
 */
public class DeviceMonitorService {
    private static final Logger logger = LoggerFactory.getLogger(DeviceMonitorService.class);

    private final DeviceManager deviceManager;
    private final IPortScanner portScanner;
    private final int scanIntervalMs;
    private ScheduledFuture<?> monitoringTask;
    private boolean monitoring = false;         // No need to be volatile because startMonitoring() is synchronized
    private Set<String> knownPorts;

    public DeviceMonitorService(DeviceManager deviceManager, IPortScanner portScanner, int scanIntervalMs) {
        this.deviceManager = deviceManager;
        this.portScanner = portScanner;
        this.scanIntervalMs = scanIntervalMs;
    }

    /**
     * Start port monitoring, nothing is scheduled when every device is virtual
     */
    public synchronized void startMonitoring(ScheduledExecutorService executor) {
        if (monitoring) {
            logger.warn("Device monitoring is already running");
            return;
        }
        boolean anyPort = deviceManager.getHandles().stream().anyMatch(h -> !h.getConfig().isVirtual());
        if (!anyPort) {
            logger.info("Only virtual devices configured, device monitoring not needed");
            return;
        }

        logger.info("Starting device monitoring (interval {}ms)", scanIntervalMs);
        monitoring = true;
        monitoringTask = executor.scheduleWithFixedDelay(
                this::scan,
                0,
                scanIntervalMs,
                TimeUnit.MILLISECONDS
        );
    }

    /**
     * Stop port monitoring
     */
    public synchronized void stopMonitoring() {
        if (!monitoring) {
            return;
        }

        logger.info("Stopping device monitoring");
        monitoring = false;

        if (monitoringTask != null) {
            monitoringTask.cancel(true);
            monitoringTask = null;
        }
    }

    /**
     * Run one scan and apply port changes to the device handles
     */
    public synchronized void scan() {
        Set<String> ports;
        try {
            ports = portScanner.scan();
        } catch (Exception e) {
            logger.error("Error during port scan", e);
            return;
        }

        for (DeviceHandle handle : deviceManager.getHandles()) {
            String port = handle.getConfig().port();
            if (port == null) {
                continue;
            }
            boolean present = ports.contains(port);
            boolean wasPresent = knownPorts == null ? handle.isAttached() : knownPorts.contains(port);
            try {
                if (present && !wasPresent) {
                    deviceManager.markAttached(handle.getId(), "port " + port + " appeared");
                } else if (!present && wasPresent) {
                    deviceManager.markDetached(handle.getId(), "port " + port + " disappeared");
                }
            } catch (DeviceNotFoundException e) {
                logger.error("Device vanished from manager during scan", e);
            }
        }
        knownPorts = new HashSet<>(ports);
    }

    public synchronized boolean isMonitoring() {
        return monitoring;
    }
}
