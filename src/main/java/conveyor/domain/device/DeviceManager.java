package conveyor.domain.device;

import com.google.common.eventbus.EventBus;
import conveyor.dal.DeviceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the handles of all configured printers and announces connection changes
 * on the device event bus.
 *
 * @since 15/10/2025
 */
public class DeviceManager {
    private static final Logger logger = LoggerFactory.getLogger(DeviceManager.class);

    private final Map<String, DeviceHandle> handles;
    private final EventBus eventBus;

    public DeviceManager(List<DeviceConfig> devices, EventBus eventBus) {
        Map<String, DeviceHandle> map = new LinkedHashMap<>();
        for (DeviceConfig device : devices) {
            map.put(device.id(), new DeviceHandle(device));
        }
        this.handles = Collections.unmodifiableMap(map);
        this.eventBus = eventBus;
        logger.info("Device manager initialized with {} device(s): {}", handles.size(), handles.keySet());
    }

    /**
     * Get handle of a configured device
     * @throws DeviceNotFoundException if the id is unknown
     */
    public DeviceHandle get(String deviceId) throws DeviceNotFoundException {
        DeviceHandle handle = deviceId == null ? null : handles.get(deviceId);
        if (handle == null) {
            throw new DeviceNotFoundException(deviceId);
        }
        return handle;
    }

    public boolean contains(String deviceId) {
        return deviceId != null && handles.containsKey(deviceId);
    }

    public Collection<DeviceHandle> getHandles() {
        return handles.values();
    }

    public List<DeviceStatus> getStatuses() {
        List<DeviceStatus> statuses = new ArrayList<>();
        for (DeviceHandle handle : handles.values()) {
            statuses.add(handle.status());
        }
        return statuses;
    }

    /**
     * Mark device unavailable, a detached device is never handed to a new job
     */
    public void markDetached(String deviceId, String reason) throws DeviceNotFoundException {
        DeviceHandle handle = get(deviceId);
        if (handle.setAttached(false)) {
            logger.warn("⚠ Device '{}' detached: {}", deviceId, reason);
            eventBus.post(new DeviceConnectionEvent(deviceId, false, reason));
        }
    }

    /**
     * Mark device available again
     */
    public void markAttached(String deviceId, String reason) throws DeviceNotFoundException {
        DeviceHandle handle = get(deviceId);
        if (handle.setAttached(true)) {
            logger.info("✓ Device '{}' attached: {}", deviceId, reason);
            eventBus.post(new DeviceConnectionEvent(deviceId, true, reason));
        }
    }

    public EventBus getEventBus() {
        return eventBus;
    }
}
