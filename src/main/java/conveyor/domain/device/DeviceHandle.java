package conveyor.domain.device;

import conveyor.dal.DeviceConfig;

/**
 * Exclusive-access token for one printer.
 * <p>At most one job holds the handle at a time. A detached handle (connection lost, port gone)
 * cannot be acquired until it is attached again.</p>
 *
 * @since 15/10/2025
 */
public class DeviceHandle {
    private final DeviceConfig config;
    private String holder;
    private boolean attached = true;

    public DeviceHandle(DeviceConfig config) {
        this.config = config;
    }

    public String getId() {
        return config.id();
    }

    public DeviceConfig getConfig() {
        return config;
    }

    /**
     * Acquire the handle for a job
     * @return false when the device is held by another job or detached
     */
    public synchronized boolean tryAcquire(String jobId) {
        if (!attached) {
            return false;
        }
        if (holder != null) {
            return holder.equals(jobId);
        }
        holder = jobId;
        return true;
    }

    /**
     * Release the handle, ignored unless {@code jobId} is the current holder
     */
    public synchronized boolean release(String jobId) {
        if (holder == null || !holder.equals(jobId)) {
            return false;
        }
        holder = null;
        return true;
    }

    public synchronized String getHolder() {
        return holder;
    }

    public synchronized boolean isAttached() {
        return attached;
    }

    public synchronized boolean isAvailable() {
        return attached && holder == null;
    }

    synchronized boolean setAttached(boolean attached) {
        boolean changed = this.attached != attached;
        this.attached = attached;
        return changed;
    }

    public synchronized DeviceStatus status() {
        return new DeviceStatus(config.id(), config.name(), config.port(), config.isVirtual(), attached, holder);
    }

    @Override
    public String toString() {
        return "DeviceHandle{" + config.id() + "}";
    }
}
