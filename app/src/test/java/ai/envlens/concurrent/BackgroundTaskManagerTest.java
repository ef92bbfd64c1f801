package ai.envlens.concurrent;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class BackgroundTaskManagerTest {

    @Test
    void spawnedTaskResultIsAvailable() throws Exception {
        var tasks = new BackgroundTaskManager();
        var handle = tasks.spawn("answer", token -> 42);
        assertEquals(42, handle.future().get(5, TimeUnit.SECONDS));
        tasks.shutdown(Duration.ofSeconds(1));
    }

    @Test
    void finishedTasksReleaseTheirTokens() throws Exception {
        var tasks = new BackgroundTaskManager();
        for (int i = 0; i < 20; i++) {
            tasks.spawn("task-" + i, token -> "done").future().get(5, TimeUnit.SECONDS);
            tasks.spawnInLane("lane", "lane-" + i, token -> "done").future().get(5, TimeUnit.SECONDS);
        }
        assertEquals(0, tasks.rootToken().listenerCount());
        tasks.shutdown(Duration.ofSeconds(1));
    }

    @Test
    void laneTasksRunOneAtATimeInSubmissionOrder() throws Exception {
        var tasks = new BackgroundTaskManager();
        var release = new CountDownLatch(1);
        var order = new CopyOnWriteArrayList<String>();
        var first = tasks.spawnInLane("files", "first", token -> {
            try {
                assertTrue(release.await(5, TimeUnit.SECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            order.add("first");
            return 1;
        });
        var second = tasks.spawnInLane("files", "second", token -> order.add("second"));
        var other = tasks.spawnInLane("elsewhere", "other", token -> order.add("other"));

        other.future().get(5, TimeUnit.SECONDS);
        assertFalse(second.future().isDone());
        release.countDown();
        second.future().get(5, TimeUnit.SECONDS);
        assertEquals(List.of("other", "first", "second"), order);
        assertEquals(1, first.future().get(5, TimeUnit.SECONDS));
        tasks.shutdown(Duration.ofSeconds(1));
    }

    @Test
    void laneTaskCancelledBeforeItsTurnNeverRuns() throws Exception {
        var tasks = new BackgroundTaskManager();
        var blocker = tasks.spawnInLane("files", "blocker", token -> {
            token.asFuture().join();
            return null;
        });
        var ran = new CountDownLatch(1);
        var skipped = tasks.spawnInLane("files", "skipped", token -> {
            ran.countDown();
            return null;
        });
        skipped.cancel();
        blocker.cancel();
        var e = assertThrows(ExecutionException.class, () -> skipped.future().get(5, TimeUnit.SECONDS));
        assertInstanceOf(CancellationException.class, e.getCause());
        assertEquals(1, ran.getCount());
        tasks.shutdown(Duration.ofSeconds(1));
    }

    @Test
    void shutdownCancelsRunningTasks() throws Exception {
        var tasks = new BackgroundTaskManager();
        var started = new CountDownLatch(1);
        var handle = tasks.spawn("loop", token -> {
            started.countDown();
            int iterations = 0;
            while (!token.isCancelled()) {
                iterations++;
                Thread.onSpinWait();
            }
            return iterations;
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));
        tasks.shutdown(Duration.ofSeconds(5));
        assertTrue(handle.token().isCancelled());
        assertTrue(handle.future().isDone());
    }

    @Test
    void cancellingOneHandleLeavesOthersRunning() throws Exception {
        var tasks = new BackgroundTaskManager();
        var a = tasks.spawn("a", token -> {
            token.asFuture().join();
            return "a";
        });
        var b = tasks.spawn("b", token -> "b");
        a.cancel();
        assertEquals("a", a.future().get(5, TimeUnit.SECONDS));
        assertEquals("b", b.future().get(5, TimeUnit.SECONDS));
        assertFalse(tasks.rootToken().isCancelled());
        tasks.shutdown(Duration.ofSeconds(1));
    }

    @Test
    void failuresSurfaceThroughTheFutureAndNotShutdown() {
        var tasks = new BackgroundTaskManager();
        var handle = tasks.spawn("fails", token -> {
            throw new IllegalStateException("broken");
        });
        var e = assertThrows(ExecutionException.class, () -> handle.future().get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertDoesNotThrow(() -> tasks.shutdown(Duration.ofMillis(100)));
    }
}
