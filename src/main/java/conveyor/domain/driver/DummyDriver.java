package conveyor.domain.driver;

import conveyor.domain.device.DeviceHandle;
import conveyor.domain.job.CancellationToken;
import io.reactivex.rxjava3.core.Observable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Simulated printer: streams the toolpath line by line with a fixed delay per line.
 * Printing to a file copies the streamed lines into the output file.
 */
public class DummyDriver implements IPrinterDriver {
    private static final Logger logger = LoggerFactory.getLogger(DummyDriver.class);

    @Override
    public Observable<PrintProgress> print(PrintRequest request, DeviceHandle device, CancellationToken token) {
        return Observable.create(emitter -> {
            List<String> lines;
            long totalBytes;
            try {
                lines = Files.readAllLines(request.toolpath(), StandardCharsets.UTF_8);
                totalBytes = Files.size(request.toolpath());
            } catch (IOException e) {
                emitter.onError(new PrintFailedException("Cannot read toolpath " + request.toolpath() + ": " + e.getMessage(), e));
                return;
            }

            long delay = request.profile().lineDelayMs();
            long total = lines.size();
            long bytes = 0;
            logger.info("Printing job {} on {} ({} lines, build '{}')", request.jobId(), device.getId(), total, request.buildName());

            for (int i = 0; i < total; i++) {
                if (emitter.isDisposed()) {
                    return;
                }
                if (token.isCancelled()) {
                    abort(request, device);
                    emitter.onError(new CancellationException("Print aborted at line " + i));
                    return;
                }
                if (!device.isAttached()) {
                    emitter.onError(new DeviceDisconnectedException(device.getId(),
                            "Device " + device.getId() + " disconnected at line " + i));
                    return;
                }
                if (delay > 0) {
                    Thread.sleep(delay);
                }
                bytes = Math.min(totalBytes, bytes + lines.get(i).getBytes(StandardCharsets.UTF_8).length + 1);
                emitter.onNext(new PrintProgress(i + 1, total, bytes, totalBytes));
            }
            emitter.onComplete();
        });
    }

    @Override
    public Observable<PrintProgress> printToFile(PrintRequest request, Path output, CancellationToken token) {
        return Observable.create(emitter -> {
            List<String> lines;
            try {
                lines = Files.readAllLines(request.toolpath(), StandardCharsets.UTF_8);
                if (output.getParent() != null) {
                    Files.createDirectories(output.getParent());
                }
            } catch (IOException e) {
                emitter.onError(new PrintFailedException("Cannot prepare build file " + output + ": " + e.getMessage(), e));
                return;
            }

            long total = lines.size();
            long bytes = 0;
            logger.info("Writing job {} to {} ({} lines, build '{}')", request.jobId(), output, total, request.buildName());
            try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
                writer.write("; build " + (request.buildName() == null ? "" : request.buildName()));
                writer.newLine();
                for (int i = 0; i < total; i++) {
                    if (emitter.isDisposed()) {
                        return;
                    }
                    if (token.isCancelled()) {
                        emitter.onError(new CancellationException("Print to file aborted at line " + i));
                        return;
                    }
                    String line = lines.get(i);
                    writer.write(line);
                    writer.newLine();
                    bytes += line.getBytes(StandardCharsets.UTF_8).length + 1;
                    emitter.onNext(new PrintProgress(i + 1, total, bytes, 0));
                }
            } catch (IOException e) {
                emitter.onError(new PrintFailedException("Cannot write build file " + output + ": " + e.getMessage(), e));
                return;
            }
            emitter.onComplete();
        });
    }

    private void abort(PrintRequest request, DeviceHandle device) {
        // heaters off, motors off, park
        logger.info("Running abort sequence for job {} on {}", request.jobId(), device.getId());
    }
}
