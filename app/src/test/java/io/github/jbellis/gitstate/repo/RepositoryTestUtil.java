package io.github.jbellis.gitstate.repo;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/** Helpers for tests that drive a {@link Repository} through its futures. */
final class RepositoryTestUtil {
    static final long TIMEOUT_SECONDS = 30;

    private RepositoryTestUtil() {}

    /** Opens {@code dir} and waits until it has finished loading. */
    static Repository open(Path dir) throws Exception {
        var repository = new Repository(dir);
        repository.getLoadPromise().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        return repository;
    }

    static <T> T await(CompletableFuture<T> future) throws Exception {
        try {
            return future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw e;
        }
    }

    /** Waits for {@code future} to fail and returns what it failed with. */
    static Throwable failure(CompletableFuture<?> future) throws InterruptedException, TimeoutException {
        try {
            future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            while (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            return cause;
        }
        return fail("expected " + future + " to fail");
    }
}
