package conveyor.domain.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between the orchestrator and the backend adapters.
 * <p>Adapters check {@link #isCancelled()} at their invocation boundaries and register
 * callbacks that forward the cancel into the external process (terminate a slicer, send the
 * abort sequence to a driver). Each callback runs at most once.</p>
 *
 * @since 16/10/2025
 */
public final class CancellationToken {
    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Callback> callbacks = new CopyOnWriteArrayList<>();

    /**
     * Handle returned by {@link #onCancel(Runnable)}, closing it unregisters the callback
     */
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Request cancellation and run all registered callbacks
     * @return true if this call flipped the flag
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Callback callback : callbacks) {
            callback.run();
        }
        return true;
    }

    /**
     * Register a callback, it runs immediately when the token is already cancelled
     */
    public Registration onCancel(Runnable action) {
        Callback callback = new Callback(action);
        callbacks.add(callback);
        if (cancelled.get()) {
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * @throws CancellationException if cancellation was requested
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Cancel requested");
        }
    }

    private static final class Callback {
        private final Runnable action;
        private final AtomicBoolean done = new AtomicBoolean(false);

        Callback(Runnable action) {
            this.action = action;
        }

        void run() {
            if (!done.compareAndSet(false, true)) {
                return;
            }
            try {
                action.run();
            } catch (RuntimeException e) {
                logger.error("Cancel callback failed", e);
            }
        }
    }
}
