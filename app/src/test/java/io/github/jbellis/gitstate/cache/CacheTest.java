package io.github.jbellis.gitstate.cache;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class CacheTest {
    private final Cache cache = new Cache();

    @Test
    void secondReadIsServedFromCache() throws Exception {
        var calls = new AtomicInteger();
        var first = cache.getOrSet(CacheKey.CHANGED_FILES, () -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture("status");
        });
        var second = cache.getOrSet(CacheKey.CHANGED_FILES, () -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture("other");
        });

        assertSame(first, second);
        assertEquals("status", second.get());
        assertEquals(1, calls.get());
    }

    @Test
    void concurrentReadersShareTheInFlightComputation() throws Exception {
        var pending = new CompletableFuture<Integer>();
        var calls = new AtomicInteger();
        var first = cache.getOrSet(CacheKey.aheadCount("main"), () -> {
            calls.incrementAndGet();
            return pending;
        });
        var second = cache.getOrSet(CacheKey.aheadCount("main"), () -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(99);
        });

        assertSame(first, second);
        pending.complete(3);
        assertEquals(3, second.get());
        assertEquals(1, calls.get());
    }

    @Test
    void failedComputationIsEvictedAndUnwrapped() {
        var failed = cache.<String>getOrSet(
                CacheKey.LAST_COMMIT,
                () -> CompletableFuture.supplyAsync(() -> {
                    throw new CompletionException(new IOException("disk"));
                }));

        var ex = assertThrows(ExecutionException.class, failed::get);
        assertInstanceOf(IOException.class, ex.getCause());
        assertFalse(cache.has(CacheKey.LAST_COMMIT));

        var retried = cache.getOrSet(CacheKey.LAST_COMMIT, () -> CompletableFuture.completedFuture("ok"));
        assertEquals("ok", retried.join());
    }

    @Test
    void throwingSupplierIsEvicted() {
        var failed = cache.getOrSet(CacheKey.BRANCHES, () -> {
            throw new IllegalStateException("closed");
        });
        assertTrue(failed.isCompletedExceptionally());
        assertFalse(cache.has(CacheKey.BRANCHES));
    }

    @Test
    void invalidatingKeysRemovesOnlyThoseKeys() {
        prime(CacheKey.CHANGED_FILES, CacheKey.STAGED_CHANGES, CacheKey.index("a.txt"), CacheKey.index("b.txt"));

        cache.invalidate(List.of(CacheKey.CHANGED_FILES, CacheKey.index("a.txt")));

        assertFalse(cache.has(CacheKey.CHANGED_FILES));
        assertFalse(cache.has(CacheKey.index("a.txt")));
        assertTrue(cache.has(CacheKey.STAGED_CHANGES));
        assertTrue(cache.has(CacheKey.index("b.txt")));
    }

    @Test
    void invalidatingGroupRemovesEveryMember() {
        var unstaged = CacheKey.filePatch("a.txt", false, false);
        var staged = CacheKey.filePatch("a.txt", true, false);
        var amending = CacheKey.filePatch("a.txt", true, true);
        prime(unstaged, staged, amending, CacheKey.aheadCount("main"), CacheKey.aheadCount("dev"));

        cache.invalidate(List.of(CacheGroup.STAGED_FILE_PATCHES, KeyKind.AHEAD_COUNT.group()));

        assertTrue(cache.has(unstaged));
        assertFalse(cache.has(staged));
        assertFalse(cache.has(amending));
        assertFalse(cache.has(CacheKey.aheadCount("main")));
        assertFalse(cache.has(CacheKey.aheadCount("dev")));
    }

    @Test
    void invalidatedInFlightReadStillCompletesForItsCallers() throws Exception {
        var pending = new CompletableFuture<String>();
        var inFlight = cache.getOrSet(CacheKey.REMOTES, () -> pending);

        cache.invalidate(List.of(CacheKey.REMOTES));
        var fresh = cache.getOrSet(CacheKey.REMOTES, () -> CompletableFuture.completedFuture("new"));

        assertNotSame(inFlight, fresh);
        pending.complete("old");
        assertEquals("old", inFlight.get());
        assertEquals("new", cache.peek(CacheKey.REMOTES).orElseThrow().get());
    }

    @Test
    void clearEmptiesTheCache() {
        prime(CacheKey.CHANGED_FILES, CacheKey.REMOTES);
        assertEquals(2, cache.size());

        cache.clear();
        assertEquals(0, cache.size());
        assertTrue(cache.peek(CacheKey.CHANGED_FILES).isEmpty());
    }

    private void prime(CacheKey... keys) {
        for (var key : keys) {
            cache.getOrSet(key, () -> CompletableFuture.completedFuture(key.toString()));
        }
    }
}
