package conveyor.domain.driver;

import conveyor.common.BackendConstants;
import conveyor.common.ProcessUtils;
import conveyor.dal.DriverProfile;
import conveyor.domain.device.DeviceHandle;
import conveyor.domain.job.CancellationToken;
import io.reactivex.rxjava3.core.Observable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Driver backed by an external MakerBot driver process.
 * <p>Runs {@code <exe> --port <port> --machine <machine> --profile-dir <dir> --build-name <name> <toolpath>}
 * and reads {@code progress <line> <total> [<byte> <totalBytes>]} lines from its stdout. Printing to a
 * file replaces {@code --port} with {@code --output <file>}. Exit code 3 reports a lost connection.
 * Exit code 0 is a completed print unless an abort was delivered to the driver. A cancel writes {@code abort} to the driver's stdin, the driver gets
 * the profile's abort grace period to finish its abort sequence before it is terminated.</p>
 *
 * @since 18/10/2025
 */
public class MakerBotDriver implements IPrinterDriver {
    private static final Logger logger = LoggerFactory.getLogger(MakerBotDriver.class);
    private static final String NAME = "MakerBot driver";

    @Override
    public Observable<PrintProgress> print(PrintRequest request, DeviceHandle device, CancellationToken token) {
        return run(request, device, null, token);
    }

    @Override
    public Observable<PrintProgress> printToFile(PrintRequest request, Path output, CancellationToken token) {
        return run(request, null, output, token);
    }

    /**
     * Run the driver process against a device or, with a null device, into {@code output}
     */
    private Observable<PrintProgress> run(PrintRequest request, DeviceHandle device, Path output, CancellationToken token) {
        return Observable.create(emitter -> {
            String target = device != null ? device.getId() : output.toString();
            Process process;
            try {
                List<String> command = buildCommand(request, device, output);
                logger.info("Printing job {} to {} with {}", request.jobId(), target, NAME);
                logger.debug("{} command: {}", NAME, String.join(" ", command));
                process = new ProcessBuilder(command).start();
            } catch (IOException e) {
                emitter.onError(new PrintFailedException(NAME + " could not be started: " + e.getMessage(), e));
                return;
            }

            ProcessUtils.OutputTail tail = new ProcessUtils.OutputTail(BackendConstants.DIAGNOSTIC_TAIL_LINES);
            ProcessUtils.drain(process.getErrorStream(), NAME, line -> {
                logger.debug("{}: {}", NAME, line);
                tail.add(line);
            });
            emitter.setCancellable(() -> ProcessUtils.terminate(process, BackendConstants.PROCESS_TERMINATION_GRACE_MS, NAME));

            AtomicBoolean abortSent = new AtomicBoolean();
            CancellationToken.Registration registration = token.onCancel(
                    () -> abort(process, request.profile().abortGraceMs(), abortSent));
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    PrintProgress progress = parseProgress(line);
                    if (progress != null) {
                        emitter.onNext(progress);
                    } else {
                        logger.debug("{}: {}", NAME, line);
                        tail.add(line);
                    }
                }

                int code = process.waitFor();
                logger.debug("{} terminated with status code {}", NAME, code);
                Throwable failure = exitFailure(code, abortSent.get(), token.isCancelled(), device, tail.lines());
                if (failure == null) {
                    emitter.onComplete();
                } else {
                    emitter.onError(failure);
                }
            } finally {
                registration.close();
                if (process.isAlive()) {
                    process.destroyForcibly();
                }
            }
        });
    }

    /**
     * Map the driver exit to the stream outcome, null for a completed print.
     * A cancel that arrives after a clean exit did not abort anything.
     */
    static Throwable exitFailure(int code, boolean abortSent, boolean cancelled, DeviceHandle device,
                                 List<String> diagnostics) {
        if (code == 0 && !abortSent) {
            return null;
        }
        if (cancelled) {
            return new CancellationException("Print aborted");
        }
        if (device != null && (code == BackendConstants.EXIT_DEVICE_DISCONNECTED || !device.isAttached())) {
            return new DeviceDisconnectedException(device.getId(),
                    "Connection to " + device.getId() + " lost (driver exit code " + code + ")");
        }
        return new PrintFailedException(NAME + " exited with code " + code, diagnostics);
    }

    List<String> buildCommand(PrintRequest request, DeviceHandle device) {
        return buildCommand(request, device, null);
    }

    List<String> buildCommand(PrintRequest request, DeviceHandle device, Path output) {
        DriverProfile profile = request.profile();
        List<String> command = new ArrayList<>();
        command.add(profile.executable().toString());
        if (device != null && device.getConfig().port() != null) {
            command.add("--port");
            command.add(device.getConfig().port());
        }
        if (output != null) {
            command.add("--output");
            command.add(output.toAbsolutePath().toString());
        }
        command.add("--machine");
        command.add(profile.machine());
        if (profile.profileDir() != null) {
            command.add("--profile-dir");
            command.add(profile.profileDir().toString());
        }
        if (request.buildName() != null) {
            command.add("--build-name");
            command.add(request.buildName());
        }
        command.add(request.toolpath().toAbsolutePath().toString());
        return command;
    }

    /**
     * Parse a progress line, null when the line is not a progress report
     */
    static PrintProgress parseProgress(String line) {
        if (!line.startsWith(BackendConstants.DRIVER_PROGRESS_PREFIX)) {
            return null;
        }
        String[] parts = line.substring(BackendConstants.DRIVER_PROGRESS_PREFIX.length()).trim().split("\\s+");
        try {
            long current = Long.parseLong(parts[0]);
            long total = parts.length > 1 ? Long.parseLong(parts[1]) : 0;
            long currentByte = parts.length > 3 ? Long.parseLong(parts[2]) : 0;
            long totalBytes = parts.length > 3 ? Long.parseLong(parts[3]) : 0;
            return new PrintProgress(current, total, currentByte, totalBytes);
        } catch (NumberFormatException e) {
            logger.warn("Malformed progress line from driver: '{}'", line);
            return null;
        }
    }

    /**
     * Ask a running driver to abort, {@code abortSent} records that the abort reached it
     */
    private void abort(Process process, long graceMs, AtomicBoolean abortSent) {
        if (!process.isAlive()) {
            return;
        }
        abortSent.set(true);
        logger.info("Sending abort to {} (pid {})", NAME, process.pid());
        try {
            OutputStream stdin = process.getOutputStream();
            stdin.write((BackendConstants.DRIVER_ABORT_COMMAND + "\n").getBytes(StandardCharsets.UTF_8));
            stdin.flush();
        } catch (IOException e) {
            logger.warn("⚠ Could not send abort to {}: {}", NAME, e.getMessage());
            ProcessUtils.terminate(process, BackendConstants.PROCESS_TERMINATION_GRACE_MS, NAME);
            return;
        }
        process.onExit()
                .completeOnTimeout(process, graceMs, TimeUnit.MILLISECONDS)
                .thenAccept(p -> ProcessUtils.terminate(p, BackendConstants.PROCESS_TERMINATION_GRACE_MS, NAME));
    }
}
