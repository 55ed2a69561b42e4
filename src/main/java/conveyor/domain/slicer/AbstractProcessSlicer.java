package conveyor.domain.slicer;

import conveyor.common.BackendConstants;
import conveyor.common.ProcessUtils;
import conveyor.domain.job.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

/**
 * Base class for slicers that run an external executable.
 * <p>Subclasses build the command line and may post-process the output. This class owns the
 * process: merged stdout/stderr is logged and kept as a diagnostic tail, and the process is gone
 * on every exit path.</p>
 *
 * @since 17/10/2025
 */
public abstract class AbstractProcessSlicer implements ISlicer {
    private static final Logger logger = LoggerFactory.getLogger(AbstractProcessSlicer.class);

    /**
     * Get display name of the backend, used in logs and diagnostics
     */
    protected abstract String getBackendName();

    /**
     * Prepare per-job inputs and build the command line
     */
    protected abstract List<String> buildCommand(SliceRequest request) throws IOException;

    /**
     * Move the backend's result to {@link SliceRequest#outputPath()}, if the backend does not write it there
     */
    protected Path collectOutput(SliceRequest request) throws IOException {
        return request.outputPath();
    }

    @Override
    public Path slice(SliceRequest request, CancellationToken token) throws SliceFailedException, InterruptedException {
        token.throwIfCancelled();

        List<String> command;
        Process process;
        try {
            Files.createDirectories(request.workDir());
            command = buildCommand(request);
            logger.info("Slicing {} with {} (profile '{}')", request.modelPath(), getBackendName(), request.profile().name());
            logger.debug("{} command: {}", getBackendName(), String.join(" ", command));
            process = new ProcessBuilder(command)
                    .directory(request.workDir().toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new SliceFailedException(getBackendName() + " could not be started: " + e.getMessage(), e);
        }

        ProcessUtils.OutputTail tail = new ProcessUtils.OutputTail(BackendConstants.DIAGNOSTIC_TAIL_LINES);
        Thread reader = ProcessUtils.drain(process.getInputStream(), getBackendName(), line -> {
            logger.debug("{}: {}", getBackendName(), line);
            tail.add(line);
        });

        CancellationToken.Registration registration = token.onCancel(
                () -> ProcessUtils.terminate(process, BackendConstants.PROCESS_TERMINATION_GRACE_MS, getBackendName()));
        try {
            long timeoutMs = request.profile().timeoutMs();
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new SliceFailedException(getBackendName() + " timed out after " + timeoutMs + "ms", -1, tail.lines());
            }
            reader.join(BackendConstants.PROCESS_TERMINATION_GRACE_MS);

            if (token.isCancelled()) {
                throw new CancellationException(getBackendName() + " cancelled");
            }

            int code = process.exitValue();
            logger.debug("{} terminated with status code {}", getBackendName(), code);
            if (code != 0) {
                throw new SliceFailedException(getBackendName() + " exited with code " + code, code, tail.lines());
            }

            Path output;
            try {
                output = collectOutput(request);
            } catch (IOException e) {
                throw new SliceFailedException(getBackendName() + " output could not be collected: " + e.getMessage(), e);
            }
            if (!Files.isRegularFile(output) || sizeOf(output) == 0) {
                throw new SliceFailedException(getBackendName() + " produced no toolpath", code, tail.lines());
            }
            logger.info("✓ {} produced {} ({} bytes)", getBackendName(), output, sizeOf(output));
            return output;
        } finally {
            registration.close();
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            return 0;
        }
    }
}
