package conveyor.dal;

import conveyor.common.EProfileKind;

/**
 * Named, immutable bundle of backend settings
 * @since 14/10/2025
 */
public interface Profile {
    String name();
    EProfileKind kind();
    String backendName();
}
