package conveyor.domain.driver;

import java.util.Collections;
import java.util.List;

/**
 * The printer driver failed for a reason other than a lost connection
 */
public class PrintFailedException extends Exception {
    private final List<String> diagnostics;

    public PrintFailedException(String message) {
        this(message, (List<String>) null);
    }

    public PrintFailedException(String message, List<String> diagnostics) {
        super(message);
        this.diagnostics = diagnostics == null ? Collections.emptyList() : Collections.unmodifiableList(diagnostics);
    }

    public PrintFailedException(String message, Throwable cause) {
        super(message, cause);
        this.diagnostics = Collections.emptyList();
    }

    public List<String> getDiagnostics() {
        return diagnostics;
    }
}
