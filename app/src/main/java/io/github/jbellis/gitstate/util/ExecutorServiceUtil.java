package io.github.jbellis.gitstate.util;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Executors owned by a repository instance. */
public final class ExecutorServiceUtil {
    private static final Logger logger = LogManager.getLogger(ExecutorServiceUtil.class);

    private ExecutorServiceUtil() {}

    /** {@code gitstate-<directory name>-}, or {@code gitstate-none-} for an instance without a directory. */
    public static String threadPrefix(@Nullable Path workingDirectory) {
        var fileName = workingDirectory == null ? null : workingDirectory.getFileName();
        return "gitstate-" + (fileName == null ? "none" : fileName.toString()) + "-";
    }

    /**
     * The pool a repository runs its reads and its serial lanes on: {@code threads} daemon threads named
     * {@link #threadPrefix} plus a counter.
     */
    public static ExecutorService newRepositoryExecutor(@Nullable Path workingDirectory, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("executor.threads must be at least 1, got " + threads);
        }
        var prefix = threadPrefix(workingDirectory);
        var counter = new AtomicInteger();
        ThreadFactory factory = task -> {
            var thread = new Thread(task, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler(
                    (t, e) -> logger.error("Uncaught exception on {}", t.getName(), e));
            return thread;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }
}
