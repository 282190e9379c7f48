package io.github.jbellis.gitstate.cache;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Memoizes asynchronous reads by {@link CacheKey}.
 *
 * <p>The first caller for a key installs a placeholder future and starts the computation; callers arriving while it
 * runs get the same placeholder. A computation that fails is evicted before its placeholder completes, so the next
 * read retries. Invalidating an in-flight key detaches the placeholder: its callers still get the result, but it is
 * never served again.
 */
public class Cache {
    private static final Logger logger = LogManager.getLogger(Cache.class);

    private final ConcurrentHashMap<CacheKey, CompletableFuture<?>> entries = new ConcurrentHashMap<>();

    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> getOrSet(CacheKey key, Supplier<CompletableFuture<T>> compute) {
        var existing = entries.get(key);
        if (existing != null) {
            logger.trace("Cache hit for {}", key);
            return (CompletableFuture<T>) existing;
        }

        var placeholder = new CompletableFuture<T>();
        var raced = entries.putIfAbsent(key, placeholder);
        if (raced != null) {
            logger.trace("Cache hit for {} (in flight)", key);
            return (CompletableFuture<T>) raced;
        }
        logger.trace("Cache miss for {}", key);

        CompletableFuture<T> computation;
        try {
            computation = compute.get();
        } catch (RuntimeException e) {
            entries.remove(key, placeholder);
            placeholder.completeExceptionally(e);
            return placeholder;
        }
        computation.whenComplete((value, failure) -> {
            if (failure != null) {
                entries.remove(key, placeholder);
                placeholder.completeExceptionally(unwrap(failure));
            } else {
                placeholder.complete(value);
            }
        });
        return placeholder;
    }

    /** Removes every entry that is one of the given keys or belongs to one of the given groups. */
    public void invalidate(Collection<? extends Invalidatable> targets) {
        for (var target : targets) {
            if (target instanceof CacheKey key) {
                entries.remove(key);
            } else if (target instanceof CacheGroup group) {
                entries.keySet().removeIf(key -> key.isIn(group));
            }
        }
        logger.debug("Invalidated {}", targets);
    }

    public void clear() {
        entries.clear();
        logger.debug("Cache cleared");
    }

    public boolean has(CacheKey key) {
        return entries.containsKey(key);
    }

    /** The cached future for {@code key}, without computing anything. */
    public Optional<CompletableFuture<?>> peek(CacheKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    public int size() {
        return entries.size();
    }

    static Throwable unwrap(Throwable failure) {
        var current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
