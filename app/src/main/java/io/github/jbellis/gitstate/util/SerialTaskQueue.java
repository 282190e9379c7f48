package io.github.jbellis.gitstate.util;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs tasks on an executor so that tasks submitted to the same lane execute one at a time, in submission order.
 * Different lanes run independently of each other.
 *
 * <p>Failures are delivered to the caller as-is: a task that throws a checked exception completes its future
 * exceptionally with that exception, not a wrapper. A failed task does not stop the lane.
 *
 * <p>After {@link #close()} every new submission fails immediately with {@link RejectedExecutionException}.
 */
public class SerialTaskQueue {
    private static final Logger logger = LogManager.getLogger(SerialTaskQueue.class);

    private final Executor executor;
    private final String name;

    /** Tail of each lane: the future of the most recently submitted task. */
    private final ConcurrentHashMap<String, CompletableFuture<?>> tails = new ConcurrentHashMap<>();

    private volatile boolean closed = false;

    public SerialTaskQueue(Executor executor, String name) {
        this.executor = Objects.requireNonNull(executor);
        this.name = name;
    }

    /**
     * Queues {@code task} on {@code lane}. The returned future completes after the task has run and after the lane
     * bookkeeping for it has been cleaned up.
     */
    public <T> CompletableFuture<T> submit(String lane, Callable<T> task) {
        if (closed) {
            return CompletableFuture.failedFuture(new RejectedExecutionException(name + " is closed"));
        }

        var next = new CompletableFuture<T>();
        // the swap is atomic, so each task sees exactly one predecessor
        @Nullable CompletableFuture<?> previous = tails.put(lane, next);
        Runnable start = () -> runTask(lane, task, next);
        if (previous == null) {
            start.run();
        } else {
            // chain regardless of how the previous task ended
            previous.whenComplete((r, e) -> start.run());
        }
        return next;
    }

    private <T> void runTask(String lane, Callable<T> task, CompletableFuture<T> next) {
        if (closed) {
            tails.remove(lane, next);
            next.completeExceptionally(new RejectedExecutionException(name + " is closed"));
            return;
        }
        try {
            executor.execute(() -> {
                T value = null;
                Throwable failure = null;
                try {
                    value = task.call();
                } catch (Throwable t) {
                    logger.debug("Task on lane '{}' of {} failed: {}", lane, name, t.toString());
                    failure = t;
                }
                // cleanup precedes observable completion
                tails.remove(lane, next);
                if (failure != null) {
                    next.completeExceptionally(failure);
                } else {
                    next.complete(value);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.trace("Task on lane '{}' rejected because the executor is shut down", lane);
            tails.remove(lane, next);
            next.completeExceptionally(e);
        }
    }

    /** Rejects all future submissions. Tasks already queued fail when they reach the head of their lane. */
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    /** @return the number of lanes with queued or running tasks. */
    public int getActiveLaneCount() {
        return tails.size();
    }
}
