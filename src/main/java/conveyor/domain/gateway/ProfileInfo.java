package conveyor.domain.gateway;

import conveyor.dal.Profile;

/**
 * Profile as listed to clients
 */
public record ProfileInfo(String name, String kind, String backend, boolean defaultProfile) {

    static ProfileInfo of(Profile profile, String defaultName) {
        return new ProfileInfo(profile.name(), profile.kind().getName(), profile.backendName(), profile.name().equals(defaultName));
    }
}
