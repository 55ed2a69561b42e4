package conveyor.domain.device;

import java.util.Set;

/**
 * Lists the serial ports currently present on the host
 */
public interface IPortScanner {
    Set<String> scan();
}
