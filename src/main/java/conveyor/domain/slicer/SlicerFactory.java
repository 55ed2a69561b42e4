package conveyor.domain.slicer;

import conveyor.dal.SlicerProfile;

/**
 * Selects the slicer implementation for a profile's backend
 */
public class SlicerFactory {
    private final ISlicer miracleGrue = new MiracleGrueSlicer();
    private final ISlicer skeinforge = new SkeinforgeSlicer();
    private final ISlicer dummy = new DummySlicer();

    public ISlicer create(SlicerProfile profile) {
        switch (profile.backend()) {
            case MIRACLE_GRUE:
                return miracleGrue;
            case SKEINFORGE:
                return skeinforge;
            case DUMMY:
                return dummy;
            default:
                throw new IllegalArgumentException("Unsupported slicer backend: " + profile.backend());
        }
    }
}
