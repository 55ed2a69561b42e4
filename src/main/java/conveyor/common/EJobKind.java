package conveyor.common;

/**
 * What a job produces
 * @since 20/10/2025
 */
public enum EJobKind {
    PRINT,          // slice, then print on the job's device
    SLICE,          // slice only, the toolpath is the result
    PRINT_TO_FILE,  // slice, then the driver writes the build file instead of talking to a device
    ;

    /**
     * Only print jobs hold a device handle and wait in a device lane
     */
    public boolean usesDevice() {
        return this == PRINT;
    }
}
