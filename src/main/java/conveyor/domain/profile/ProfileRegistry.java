package conveyor.domain.profile;

import conveyor.common.EProfileKind;
import conveyor.dal.DriverProfile;
import conveyor.dal.Profile;
import conveyor.dal.SlicerProfile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named slicer and driver profiles. Built once at startup and read-only afterwards,
 * so lookups need no locking.
 *
 * @since 14/10/2025
 */
public class ProfileRegistry {
    private final Map<String, SlicerProfile> slicers;
    private final Map<String, DriverProfile> drivers;
    private final String defaultSlicer;
    private final String defaultDriver;

    public ProfileRegistry(Map<String, SlicerProfile> slicers, Map<String, DriverProfile> drivers,
                           String defaultSlicer, String defaultDriver) {
        this.slicers = Collections.unmodifiableMap(new LinkedHashMap<>(slicers));
        this.drivers = Collections.unmodifiableMap(new LinkedHashMap<>(drivers));
        this.defaultSlicer = defaultSlicer;
        this.defaultDriver = defaultDriver;
    }

    /**
     * Resolve a profile of the given kind
     * @param name profile name, null or blank selects the default profile
     * @throws ProfileNotFoundException if no such profile exists
     */
    public Profile resolve(EProfileKind kind, String name) throws ProfileNotFoundException {
        switch (kind) {
            case SLICER:
                return resolveSlicer(name);
            case DRIVER:
                return resolveDriver(name);
            default:
                throw new ProfileNotFoundException(kind, name);
        }
    }

    public SlicerProfile resolveSlicer(String name) throws ProfileNotFoundException {
        String key = isBlank(name) ? defaultSlicer : name;
        SlicerProfile profile = key == null ? null : slicers.get(key);
        if (profile == null) {
            throw new ProfileNotFoundException(EProfileKind.SLICER, name);
        }
        return profile;
    }

    public DriverProfile resolveDriver(String name) throws ProfileNotFoundException {
        String key = isBlank(name) ? defaultDriver : name;
        DriverProfile profile = key == null ? null : drivers.get(key);
        if (profile == null) {
            throw new ProfileNotFoundException(EProfileKind.DRIVER, name);
        }
        return profile;
    }

    public List<SlicerProfile> slicerProfiles() {
        return new ArrayList<>(slicers.values());
    }

    public List<DriverProfile> driverProfiles() {
        return new ArrayList<>(drivers.values());
    }

    public String getDefaultSlicer() {
        return defaultSlicer;
    }

    public String getDefaultDriver() {
        return defaultDriver;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
