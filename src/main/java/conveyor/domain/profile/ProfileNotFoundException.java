package conveyor.domain.profile;

import conveyor.common.EProfileKind;

/**
 * Client named a profile that is not configured
 */
public class ProfileNotFoundException extends Exception {
    private final EProfileKind kind;
    private final String name;

    public ProfileNotFoundException(EProfileKind kind, String name) {
        super(String.format("Unknown %s profile '%s'", kind.getName(), name));
        this.kind = kind;
        this.name = name;
    }

    public EProfileKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }
}
