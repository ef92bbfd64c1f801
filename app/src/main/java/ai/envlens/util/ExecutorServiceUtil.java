package ai.envlens.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class ExecutorServiceUtil {
    private static final Logger logger = LogManager.getLogger(ExecutorServiceUtil.class);

    private ExecutorServiceUtil() {}

    public static ExecutorService newFixedThreadExecutor(int parallelism, String threadPrefix) {
        assert parallelism >= 1 : "parallelism must be >= 1";
        return Executors.newFixedThreadPool(parallelism, createNamedThreadFactory(threadPrefix));
    }

    public static ExecutorService newCachedThreadExecutor(String threadPrefix) {
        return Executors.newCachedThreadPool(createNamedThreadFactory(threadPrefix));
    }

    public static ScheduledExecutorService newScheduledExecutor(int threads, String threadPrefix) {
        return Executors.newScheduledThreadPool(threads, createNamedThreadFactory(threadPrefix));
    }

    /** Daemon threads named {@code prefix-N} that log, rather than print, uncaught exceptions. */
    public static ThreadFactory createNamedThreadFactory(String prefix) {
        var counter = new AtomicInteger(0);
        var delegate = Executors.defaultThreadFactory();
        return r -> {
            var thread = delegate.newThread(r);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler(
                    (t, ex) -> logger.error("Uncaught exception in thread {}", t.getName(), ex));
            return thread;
        };
    }
}
