package conveyor.common;

/**
 * Kinds of named profiles held by the profile registry
 * @since 14/10/2025
 */
public enum EProfileKind {
    SLICER("slicer"),
    DRIVER("driver"),
    ;

    private final String name;

    EProfileKind(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
