package io.github.jbellis.gitstate.discard;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Undo log for destructive working-directory discards.
 *
 * <p>Each entry is the list of snapshots taken for one batch. Whole-file discards share one stack; partial discards
 * (a group key, usually the path whose lines were discarded) get a stack each. The whole history is stored as one
 * JSON blob whose hash lives in local metadata, so every instance over the same working directory restores the same
 * stacks. Serialization is deterministic, so equal histories always produce the same hash.
 */
public class DiscardHistoryStore {
    private static final Logger logger = LogManager.getLogger(DiscardHistoryStore.class);

    private static final ObjectMapper objectMapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    /** Work done between the "before" and the "after" snapshots. */
    @FunctionalInterface
    public interface Mutation<E extends Exception> {
        void run() throws E;
    }

    /** Serialized form of the history. */
    record HistoryBlob(
            @Nullable List<List<DiscardSnapshot>> whole,
            @Nullable Map<String, List<List<DiscardSnapshot>>> partial) {}

    private final ContentStore store;
    private final String configKey;
    private final int maxLength;

    // both protected by synchronized
    private final List<List<DiscardSnapshot>> wholeFileHistory = new ArrayList<>();
    private final Map<String, List<List<DiscardSnapshot>>> partialHistory = new TreeMap<>();

    public DiscardHistoryStore(ContentStore store, String configKey, int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
        }
        this.store = store;
        this.configKey = configKey;
        this.maxLength = maxLength;
    }

    /**
     * Snapshots every path {@code isSafe} accepts, runs {@code mutate} once, snapshots the same paths again and pushes
     * the pairs as one entry. Nothing runs when no path is safe.
     *
     * @param groupKey the partial stack to push onto, or null for the whole-file stack
     * @return the snapshots pushed, empty when no path was safe
     */
    public synchronized <E extends Exception> List<DiscardSnapshot> storeBeforeAndAfterBlobs(
            Collection<String> paths, Predicate<String> isSafe, Mutation<E> mutate, @Nullable String groupKey)
            throws IOException, E {
        var safePaths = paths.stream().filter(isSafe).distinct().toList();
        if (safePaths.isEmpty()) {
            logger.debug("No safe paths among {}; nothing stored", paths);
            return List.of();
        }

        var before = new LinkedHashMap<String, @Nullable String>();
        for (var path : safePaths) {
            before.put(path, snapshot(path));
        }
        mutate.run();
        var entry = new ArrayList<DiscardSnapshot>();
        for (var path : safePaths) {
            entry.add(new DiscardSnapshot(path, before.get(path), snapshot(path)));
        }

        var stack = Objects.requireNonNull(stackFor(groupKey, true));
        stack.add(List.copyOf(entry));
        while (stack.size() > maxLength) {
            stack.remove(0);
        }
        updateDiscardHistory();
        return List.copyOf(entry);
    }

    private @Nullable String snapshot(String path) throws IOException {
        var content = store.readWorkingFile(path);
        return content.isPresent() ? store.writeBlob(content.get()) : null;
    }

    /** Serializes the whole history into one blob and returns its hash. */
    public synchronized String createDiscardHistoryBlob() throws IOException {
        var partial = new TreeMap<String, List<List<DiscardSnapshot>>>(partialHistory);
        var json = objectMapper.writeValueAsBytes(new HistoryBlob(List.copyOf(wholeFileHistory), partial));
        return store.writeBlob(json);
    }

    /** Stores the current history and points the local metadata key at it. */
    public synchronized void updateDiscardHistory() throws IOException {
        var sha = createDiscardHistoryBlob();
        store.writeMetadata(configKey, sha);
        logger.debug("Discard history stored as {}", sha);
    }

    /**
     * Replaces the in-memory history with the one the metadata key points at. A missing key, an unresolvable hash or
     * an unreadable blob leaves the history empty.
     */
    public synchronized void restoreHistory() {
        wholeFileHistory.clear();
        partialHistory.clear();

        Optional<String> sha;
        try {
            sha = store.readMetadata(configKey);
        } catch (IOException e) {
            logger.warn("Unable to read {}; starting with an empty discard history: {}", configKey, e.getMessage());
            return;
        }
        if (sha.isEmpty() || sha.get().isBlank()) {
            return;
        }

        try {
            var blob = objectMapper.readValue(store.readBlob(sha.get().trim()), HistoryBlob.class);
            if (blob.whole() != null) {
                blob.whole().forEach(entry -> wholeFileHistory.add(List.copyOf(entry)));
            }
            if (blob.partial() != null) {
                blob.partial().forEach((key, stack) -> {
                    var copy = new ArrayList<List<DiscardSnapshot>>();
                    stack.forEach(entry -> copy.add(List.copyOf(entry)));
                    if (!copy.isEmpty()) {
                        partialHistory.put(key, copy);
                    }
                });
            }
            logger.debug("Restored discard history from {}", sha.get());
        } catch (MissingObjectException e) {
            logger.warn("Discard history blob {} is missing; starting with an empty history", sha.get());
        } catch (IOException e) {
            logger.warn("Discard history blob {} is unreadable; starting with an empty history: {}",
                        sha.get(), e.getMessage());
        }
    }

    /** Entries of one stack, oldest first. */
    public synchronized List<List<DiscardSnapshot>> getDiscardHistory(@Nullable String groupKey) {
        var stack = stackFor(groupKey, false);
        return stack == null ? List.of() : List.copyOf(stack);
    }

    public synchronized boolean hasDiscardHistory(@Nullable String groupKey) {
        var stack = stackFor(groupKey, false);
        return stack != null && !stack.isEmpty();
    }

    /** The most recent entry of a stack, or an empty list. */
    public synchronized List<DiscardSnapshot> getLastHistorySnapshots(@Nullable String groupKey) {
        var stack = stackFor(groupKey, false);
        return stack == null || stack.isEmpty() ? List.of() : stack.get(stack.size() - 1);
    }

    public synchronized void popDiscardHistory(@Nullable String groupKey) throws IOException {
        var stack = stackFor(groupKey, false);
        if (stack == null || stack.isEmpty()) {
            return;
        }
        stack.remove(stack.size() - 1);
        if (groupKey != null && stack.isEmpty()) {
            partialHistory.remove(groupKey);
        }
        updateDiscardHistory();
    }

    public synchronized void clearDiscardHistory(@Nullable String groupKey) throws IOException {
        if (groupKey == null) {
            wholeFileHistory.clear();
        } else {
            partialHistory.remove(groupKey);
        }
        updateDiscardHistory();
    }

    /**
     * Puts back the "before" content of the most recent entry. A file that changed since the discard is left alone
     * and reported; the entry is popped only when every file was restored.
     *
     * @return paths that no longer match their "after" snapshot
     */
    public synchronized List<String> undoLastDiscard(@Nullable String groupKey) throws IOException {
        var snapshots = getLastHistorySnapshots(groupKey);
        if (snapshots.isEmpty()) {
            return List.of();
        }

        var conflicts = new ArrayList<String>();
        for (var snapshot : snapshots) {
            var current = store.readWorkingFile(snapshot.filePath());
            if (!matches(current, snapshot.afterSha())) {
                conflicts.add(snapshot.filePath());
                continue;
            }
            var before = snapshot.beforeSha() == null ? null : store.readBlob(snapshot.beforeSha());
            store.writeWorkingFile(snapshot.filePath(), before);
        }

        if (conflicts.isEmpty()) {
            popDiscardHistory(groupKey);
        } else {
            logger.info("Could not undo discard for {}: changed since the discard", conflicts);
        }
        return conflicts;
    }

    private boolean matches(Optional<byte[]> current, @Nullable String sha) throws IOException {
        if (sha == null) {
            return current.isEmpty();
        }
        return current.isPresent() && Arrays.equals(current.get(), store.readBlob(sha));
    }

    private @Nullable List<List<DiscardSnapshot>> stackFor(@Nullable String groupKey, boolean create) {
        if (groupKey == null) {
            return wholeFileHistory;
        }
        return create ? partialHistory.computeIfAbsent(groupKey, k -> new ArrayList<>()) : partialHistory.get(groupKey);
    }

    @Override
    public synchronized String toString() {
        return "DiscardHistoryStore[" + wholeFileHistory.size() + " whole, " + partialHistory.size() + " partial]";
    }
}
