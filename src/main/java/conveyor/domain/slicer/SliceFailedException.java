package conveyor.domain.slicer;

import java.util.Collections;
import java.util.List;

/**
 * The slicing backend did not produce a toolpath
 */
public class SliceFailedException extends Exception {
    private final int exitCode;
    private final List<String> diagnostics;

    public SliceFailedException(String message, int exitCode, List<String> diagnostics) {
        super(message);
        this.exitCode = exitCode;
        this.diagnostics = diagnostics == null ? Collections.emptyList() : Collections.unmodifiableList(diagnostics);
    }

    public SliceFailedException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
        this.diagnostics = Collections.emptyList();
    }

    /**
     * Get exit code of the backend process, -1 when it did not exit normally
     */
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Get last output lines of the backend
     */
    public List<String> getDiagnostics() {
        return diagnostics;
    }
}
