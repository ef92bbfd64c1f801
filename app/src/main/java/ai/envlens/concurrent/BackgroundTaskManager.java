package ai.envlens.concurrent;

import ai.envlens.util.ExecutorServiceUtil;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tracks long-lived background work (workspace indexing, per-file re-indexing). Every task receives a child of the
 * manager's root token, released again when the task ends; {@link #shutdown(Duration)} cancels the root and joins all
 * handles.
 */
public final class BackgroundTaskManager {
    private static final Logger logger = LogManager.getLogger(BackgroundTaskManager.class);

    private final CancellationToken rootToken = CancellationToken.create();
    private final ExecutorService executor;
    private final Map<Long, Handle<?>> running = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final Map<String, CompletableFuture<?>> lanes = new HashMap<>();

    public record Handle<T>(long id, String name, CancellationToken token, CompletableFuture<T> future) {
        public void cancel() {
            token.cancel();
        }
    }

    public BackgroundTaskManager() {
        this(ExecutorServiceUtil.newCachedThreadExecutor("envlens-bg"));
    }

    BackgroundTaskManager(ExecutorService executor) {
        this.executor = executor;
    }

    public CancellationToken rootToken() {
        return rootToken;
    }

    public <T> Handle<T> spawn(String name, Function<CancellationToken, T> body) {
        var token = rootToken.child();
        var future = CompletableFuture.supplyAsync(
                () -> {
                    logger.debug("Background task {} started", name);
                    return body.apply(token);
                },
                executor);
        return track(name, token, future);
    }

    /**
     * Like {@link #spawn}, but tasks sharing {@code lane} run one at a time in submission order. A task cancelled
     * before its turn does not run.
     */
    public <T> Handle<T> spawnInLane(String lane, String name, Function<CancellationToken, T> body) {
        var token = rootToken.child();
        synchronized (lanes) {
            var previous = lanes.getOrDefault(lane, CompletableFuture.completedFuture(null));
            var handle = track(name, token, previous.handle((result, ex) -> null).thenApplyAsync(
                    ignored -> {
                        token.throwIfCancelled();
                        logger.debug("Background task {} started in lane {}", name, lane);
                        return body.apply(token);
                    },
                    executor));
            lanes.put(lane, handle.future());
            return handle;
        }
    }

    private <T> Handle<T> track(String name, CancellationToken token, CompletableFuture<T> future) {
        long id = ids.incrementAndGet();
        running.put(id, new Handle<>(id, name, token, future));
        var tracked = future.whenComplete((result, ex) -> {
            running.remove(id);
            token.detach();
            if (ex == null) {
                logger.debug("Background task {} finished", name);
            } else if (unwrap(ex) instanceof CancellationException) {
                logger.debug("Background task {} cancelled", name);
            } else {
                logger.error("Background task {} failed", name, unwrap(ex));
            }
        });
        var handle = new Handle<>(id, name, token, tracked);
        running.replace(id, handle);
        return handle;
    }

    /**
     * Signals cancellation to every task, then waits up to {@code timeout} for all of them. Tasks that fail or do not
     * finish in time are logged; this method never throws.
     */
    public void shutdown(Duration timeout) {
        logger.info("Shutting down {} background task(s)", running.size());
        rootToken.cancel();
        long deadline = System.nanoTime() + timeout.toNanos();
        for (var handle : running.values()) {
            long remaining = Math.max(0, deadline - System.nanoTime());
            try {
                handle.future().get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                logger.warn("Background task {} did not stop within {}", handle.name(), timeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while joining background task {}", handle.name());
                break;
            } catch (ExecutionException | CancellationException e) {
                logger.debug("Background task {} ended abnormally during shutdown: {}", handle.name(), e.toString());
            }
        }
        executor.shutdownNow();
    }

    private static Throwable unwrap(Throwable ex) {
        return (ex instanceof CompletionException && ex.getCause() != null) ? ex.getCause() : ex;
    }
}
