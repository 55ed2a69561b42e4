package conveyor.common;

import com.google.common.collect.EvictingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Helpers for external backend processes
 * @since 17/10/2025
 */
public final class ProcessUtils {
    private static final Logger logger = LoggerFactory.getLogger(ProcessUtils.class);

    private ProcessUtils() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    /**
     * Ask the process and its children to exit, force them after {@code graceMs}. Does not block the caller.
     */
    public static void terminate(Process process, long graceMs, String name) {
        if (!process.isAlive()) {
            return;
        }
        logger.info("Terminating {} (pid {})", name, process.pid());
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        process.onExit()
                .completeOnTimeout(process, graceMs, TimeUnit.MILLISECONDS)
                .thenAccept(p -> {
                    if (p.isAlive()) {
                        logger.warn("⚠ {} (pid {}) ignored termination, killing it", name, p.pid());
                        p.descendants().forEach(ProcessHandle::destroyForcibly);
                        p.destroyForcibly();
                    }
                });
    }

    /**
     * Bounded buffer of the last output lines of a process, used as failure diagnostics
     */
    public static final class OutputTail {
        private final Queue<String> lines;

        public OutputTail(int maxLines) {
            this.lines = EvictingQueue.create(maxLines);
        }

        public synchronized void add(String line) {
            lines.add(line);
        }

        public synchronized List<String> lines() {
            return new ArrayList<>(lines);
        }
    }

    /**
     * Start a daemon thread that drains {@code stream} line by line into {@code sink}
     */
    public static Thread drain(InputStream stream, String name, Consumer<String> sink) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    sink.accept(line);
                }
            } catch (IOException e) {
                logger.debug("Output of {} closed: {}", name, e.getMessage());
            }
        }, name + "-output");
        thread.setDaemon(true);
        thread.start();
        return thread;
    }
}
