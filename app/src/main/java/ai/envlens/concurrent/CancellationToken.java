package ai.envlens.concurrent;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Broadcast cancellation signal. One {@link #cancel()} reaches every listener and every {@link #child()}; tasks
 * either poll {@link #isCancelled()} at natural yield points or race their work against {@link #asFuture()}.
 */
public final class CancellationToken {
    private static final Logger logger = LogManager.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CompletableFuture<Void> signal = new CompletableFuture<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile Runnable detach = () -> {};

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * A token cancelled together with this one, but which can also be cancelled on its own. Call {@link #detach()} on
     * the child once its work is over so this token stops holding it.
     */
    public CancellationToken child() {
        var child = new CancellationToken();
        Runnable propagate = child::cancel;
        child.detach = () -> listeners.remove(propagate);
        onCancel(propagate);
        return child;
    }

    /** Stops following the parent's cancellation; a no-op for a token created without a parent. */
    public void detach() {
        detach.run();
    }

    int listenerCount() {
        return listeners.size();
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        signal.complete(null);
        for (var listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                logger.warn("Cancellation listener failed", e);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Runs {@code listener} on cancellation, immediately if the token is already cancelled. */
    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            listener.run();
        }
    }

    /** Completes when the token is cancelled; never completes exceptionally. */
    public CompletableFuture<Void> asFuture() {
        return signal.copy();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("cancelled");
        }
    }
}
