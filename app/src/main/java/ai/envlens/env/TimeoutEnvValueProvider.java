package ai.envlens.env;

import ai.envlens.util.ExecutorServiceUtil;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Puts a deadline on every call into a value provider. A call that times out or fails is logged and answered with
 * an empty result, so a slow value source never stalls a request.
 */
public final class TimeoutEnvValueProvider implements EnvValueProvider, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(TimeoutEnvValueProvider.class);

    private final EnvValueProvider delegate;
    private final Duration lookupTimeout;
    private final Duration refreshTimeout;
    private final ExecutorService executor = ExecutorServiceUtil.newCachedThreadExecutor("envlens-values");

    public TimeoutEnvValueProvider(EnvValueProvider delegate, Duration lookupTimeout, Duration refreshTimeout) {
        this.delegate = delegate;
        this.lookupTimeout = lookupTimeout;
        this.refreshTimeout = refreshTimeout;
    }

    @Override
    public Optional<ResolvedVariable> lookup(String name, FileContext context) {
        return call("lookup " + name, lookupTimeout, () -> delegate.lookup(name, context), Optional.empty());
    }

    @Override
    public List<ResolvedVariable> lookupAll(FileContext context) {
        return call("lookupAll", lookupTimeout, () -> delegate.lookupAll(context), List.of());
    }

    @Override
    public void refresh(RefreshOptions options) {
        call("refresh", refreshTimeout, () -> {
            delegate.refresh(options);
            return Boolean.TRUE;
        }, Boolean.FALSE);
    }

    private <T> T call(String what, Duration timeout, Supplier<T> body, T fallback) {
        var future = CompletableFuture.supplyAsync(body, executor);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Value provider {} timed out after {} ms", what, timeout.toMillis());
            return fallback;
        } catch (ExecutionException e) {
            logger.warn("Value provider {} failed", what, e.getCause());
            return fallback;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted during value provider {}", what);
            return fallback;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
