package conveyor.domain.driver;

import conveyor.domain.device.DeviceHandle;
import conveyor.domain.job.CancellationToken;
import io.reactivex.rxjava3.core.Observable;

import java.nio.file.Path;

/**
 * Printer driver contract.
 * <p>{@link #print} returns a cold, finite stream of progress. Nothing happens until it is
 * subscribed. The stream completes when the print is done or terminates with
 * {@link java.util.concurrent.CancellationException} once a requested abort has finished,
 * {@link DeviceDisconnectedException} when the connection is lost, or
 * {@link PrintFailedException} for any other failure.</p>
 * <p>{@link #printToFile} follows the same contract but writes the build file the printer would
 * receive to {@code output} instead of talking to a device.</p>
 */
public interface IPrinterDriver {
    Observable<PrintProgress> print(PrintRequest request, DeviceHandle device, CancellationToken token);

    Observable<PrintProgress> printToFile(PrintRequest request, Path output, CancellationToken token);
}
