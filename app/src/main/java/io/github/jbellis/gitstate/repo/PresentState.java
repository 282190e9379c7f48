package io.github.jbellis.gitstate.repo;

import io.github.jbellis.gitstate.cache.Cache;
import io.github.jbellis.gitstate.cache.CacheKey;
import io.github.jbellis.gitstate.cache.InvalidationTable;
import io.github.jbellis.gitstate.cache.InvalidationTable.Operation;
import io.github.jbellis.gitstate.cache.InvalidationTable.Scope;
import io.github.jbellis.gitstate.commit.CommitMessageFormatter;
import io.github.jbellis.gitstate.conflict.ConflictClassifier;
import io.github.jbellis.gitstate.conflict.MergeConflict;
import io.github.jbellis.gitstate.conflict.MergeMarkers;
import io.github.jbellis.gitstate.discard.DiscardHistoryStore;
import io.github.jbellis.gitstate.discard.DiscardSnapshot;
import io.github.jbellis.gitstate.git.Branch;
import io.github.jbellis.gitstate.git.ChangedFile;
import io.github.jbellis.gitstate.git.CommandFailure;
import io.github.jbellis.gitstate.git.CommitInfo;
import io.github.jbellis.gitstate.git.ConflictSide;
import io.github.jbellis.gitstate.git.GitStatus;
import io.github.jbellis.gitstate.git.IGitRepo;
import io.github.jbellis.gitstate.git.Remote;
import io.github.jbellis.gitstate.git.WorkingTreeStatus;
import io.github.jbellis.gitstate.patch.FilePatch;
import io.github.jbellis.gitstate.patch.PatchApplier;
import io.github.jbellis.gitstate.patch.PatchBuilder;
import io.github.jbellis.gitstate.patch.PatchRejectedException;
import io.github.jbellis.gitstate.util.SerialTaskQueue;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Predicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.jetbrains.annotations.Nullable;

/**
 * The working directory holds a repository. Reads go through the cache; mutations run on a serial lane and
 * invalidate their entry of the {@link InvalidationTable} before their future completes, whether they succeed or not.
 */
final class PresentState implements RepositoryState {
    private static final Logger logger = LogManager.getLogger(PresentState.class);

    static final String INDEX_LANE = "index";
    static final String REMOTE_LANE = "remote";
    static final String CONFIG_LANE = "config";

    private final Repository repository;
    private final IGitRepo git;
    private final DiscardHistoryStore discardHistory;
    private final Cache cache;
    private final SerialTaskQueue queue;
    private final Executor executor;
    private final CommitMessageFormatter formatter;
    private final PatchBuilder patchBuilder = new PatchBuilder();

    PresentState(Repository repository, IGitRepo git, DiscardHistoryStore discardHistory) {
        this.repository = repository;
        this.git = git;
        this.discardHistory = discardHistory;
        this.cache = repository.getCache();
        this.queue = repository.getQueue();
        this.executor = repository.getExecutor();
        this.formatter = CommitMessageFormatter.fromSettings(repository.getSettings());
    }

    @Override
    public String name() {
        return "Present";
    }

    @Override
    public boolean isPresent() {
        return true;
    }

    IGitRepo getGit() {
        return git;
    }

    DiscardHistoryStore getDiscardHistory() {
        return discardHistory;
    }

    // ---- plumbing ----

    private <T> CompletableFuture<T> read(CacheKey key, Callable<T> call) {
        return cache.getOrSet(key, () -> supply(call));
    }

    /** Runs {@code call} on the executor; failures reach the caller unwrapped. */
    private <T> CompletableFuture<T> supply(Callable<T> call) {
        var future = new CompletableFuture<T>();
        try {
            executor.execute(() -> {
                try {
                    future.complete(call.call());
                } catch (Throwable t) {
                    future.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(new NotReadyException(repository.getState().name(), "read"));
        }
        return future;
    }

    /**
     * Queues {@code task} on {@code lane}. A task still waiting when the repository is destroyed fails with
     * {@link NotReadyException} naming {@code operation}.
     */
    private <T> CompletableFuture<T> submit(String operation, String lane, Callable<T> task) {
        var result = new CompletableFuture<T>();
        queue.submit(lane, task).whenComplete((value, failure) -> {
            if (failure == null) {
                result.complete(value);
            } else if (failure instanceof RejectedExecutionException) {
                result.completeExceptionally(new NotReadyException(repository.getState().name(), operation));
            } else {
                result.completeExceptionally(failure);
            }
        });
        return result;
    }

    private <T> CompletableFuture<T> mutate(
            String operation, String lane, Operation op, Scope scope, Callable<T> call) {
        return submit(operation, lane, () -> {
            try {
                return call.call();
            } finally {
                cache.invalidate(InvalidationTable.keysFor(op, scope));
            }
        });
    }

    private CompletableFuture<Void> mutate(String operation, String lane, Operation op, Scope scope, GitAction action) {
        return mutate(operation, lane, op, scope, () -> {
            action.run();
            return null;
        });
    }

    private String historyKey() {
        return repository.getSettings().discardHistoryConfigKey();
    }

    @FunctionalInterface
    private interface GitAction {
        void run() throws Exception;
    }

    // ---- lifecycle ----

    @Override
    public CompletableFuture<Void> init() {
        return CompletableFuture.failedFuture(new CommandFailure(
                "git init", 128, "fatal: a repository already exists in " + repository.getWorkingDirectoryPath()));
    }

    @Override
    public CompletableFuture<Void> clone(String url) {
        return CompletableFuture.failedFuture(new CommandFailure(
                "git clone " + url,
                128,
                "fatal: destination path '" + repository.getWorkingDirectoryPath() + "' already exists"));
    }

    @Override
    public CompletableFuture<Boolean> isMerging() {
        return supply(git::isMerging);
    }

    // ---- index ----

    @Override
    public CompletableFuture<Void> stageFiles(Collection<String> paths) {
        var copy = List.copyOf(paths);
        return mutate("stageFiles", INDEX_LANE, Operation.STAGE_FILES, Scope.paths(copy), () -> git.stage(copy));
    }

    @Override
    public CompletableFuture<Void> unstageFiles(Collection<String> paths) {
        var copy = List.copyOf(paths);
        return mutate("unstageFiles", INDEX_LANE, Operation.UNSTAGE_FILES, Scope.paths(copy), () -> git.unstage(copy));
    }

    @Override
    public CompletableFuture<Void> stageFilesFromParentCommit(Collection<String> paths) {
        var copy = List.copyOf(paths);
        return mutate(
                "stageFilesFromParentCommit",
                INDEX_LANE,
                Operation.STAGE_FILES_FROM_PARENT,
                Scope.paths(copy),
                () -> git.stageFromCommit("HEAD~", copy));
    }

    @Override
    public CompletableFuture<Void> applyPatchToIndex(FilePatch patch) {
        var scope = Scope.paths(pathsOf(patch));
        return mutate("applyPatchToIndex", INDEX_LANE, Operation.APPLY_PATCH_TO_INDEX, scope, () -> {
            var source = patch.oldPath() != null ? patch.oldPath() : patch.filePath();
            var result = applyOrFail(patch, git.readIndexContent(source), "git apply --cached");
            if (patch.status() == GitStatus.RENAMED) {
                git.writeIndexEntry(source, null);
            }
            git.writeIndexEntry(patch.filePath(), result.orElse(null));
        });
    }

    @Override
    public CompletableFuture<Void> applyPatchToWorkdir(FilePatch patch) {
        var scope = Scope.paths(pathsOf(patch));
        return mutate("applyPatchToWorkdir", INDEX_LANE, Operation.APPLY_PATCH_TO_WORKDIR, scope, () -> {
            var source = patch.oldPath() != null ? patch.oldPath() : patch.filePath();
            var result = applyOrFail(patch, git.readWorkingTreeContent(source), "git apply");
            if (patch.status() == GitStatus.RENAMED) {
                git.writeWorkingTreeFile(source, null);
            }
            git.writeWorkingTreeFile(patch.filePath(), result.orElse(null));
        });
    }

    private static Optional<byte[]> applyOrFail(FilePatch patch, Optional<byte[]> base, String command)
            throws CommandFailure {
        try {
            return PatchApplier.apply(patch, base);
        } catch (PatchRejectedException e) {
            throw new CommandFailure(
                    command,
                    1,
                    "error: patch failed: " + e.getPath() + ":" + e.getLineNumber() + "\nerror: " + e.getPath()
                            + ": patch does not apply",
                    e);
        }
    }

    private static List<String> pathsOf(FilePatch patch) {
        var paths = new LinkedHashSet<String>();
        if (patch.oldPath() != null) {
            paths.add(patch.oldPath());
        }
        if (patch.newPath() != null) {
            paths.add(patch.newPath());
        }
        return List.copyOf(paths);
    }

    @Override
    public CompletableFuture<Void> checkoutSide(ConflictSide side, Collection<String> paths) {
        var copy = List.copyOf(paths);
        return mutate(
                "checkoutSide",
                INDEX_LANE,
                Operation.CHECKOUT_SIDE,
                Scope.paths(copy),
                () -> git.checkoutSide(side, copy));
    }

    @Override
    public CompletableFuture<Void> writeMergeConflictToIndex(
            String path, @Nullable String baseId, @Nullable String oursId, @Nullable String theirsId) {
        return mutate(
                "writeMergeConflictToIndex",
                INDEX_LANE,
                Operation.WRITE_MERGE_CONFLICT_TO_INDEX,
                Scope.paths(List.of(path)),
                () -> git.writeMergeConflictToIndex(path, baseId, oursId, theirsId));
    }

    @Override
    public CompletableFuture<Void> checkoutPathsAtRevision(Collection<String> paths, String revision) {
        var copy = List.copyOf(paths);
        return mutate(
                "checkoutPathsAtRevision",
                INDEX_LANE,
                Operation.CHECKOUT_PATHS_AT_REVISION,
                Scope.paths(copy),
                () -> git.checkoutPathsAtRevision(copy, revision));
    }

    // ---- status and content ----

    @Override
    public CompletableFuture<WorkingTreeStatus> getStatusesForChangedFiles() {
        return read(CacheKey.CHANGED_FILES, git::getStatus);
    }

    @Override
    public CompletableFuture<List<ChangedFile>> getUnstagedChanges() {
        return getStatusesForChangedFiles().thenApply(status -> toChangedFiles(status.unstaged()));
    }

    private static List<ChangedFile> toChangedFiles(Map<String, GitStatus> statuses) {
        return statuses.entrySet().stream()
                .map(e -> new ChangedFile(e.getKey(), e.getValue()))
                .toList();
    }

    @Override
    public CompletableFuture<List<ChangedFile>> getStagedChanges() {
        return read(CacheKey.STAGED_CHANGES, () -> git.getStagedStatusesAgainst("HEAD"));
    }

    @Override
    public CompletableFuture<List<ChangedFile>> getStagedChangesSinceParentCommit() {
        return read(CacheKey.STAGED_CHANGES_SINCE_PARENT, () -> git.getStagedStatusesAgainst("HEAD~"));
    }

    @Override
    public CompletableFuture<Optional<FilePatch>> getFilePatchForPath(String path, FilePatchOptions options) {
        var key = CacheKey.filePatch(path, options.staged(), options.amending());
        return read(key, () -> {
            if (!options.staged()) {
                return patchBuilder.build(
                        path,
                        git.readIndexContent(path).orElse(null),
                        git.readWorkingTreeContent(path).orElse(null));
            }
            var base = options.amending() ? "HEAD~" : "HEAD";
            return patchBuilder.build(
                    path,
                    git.readCommitContent(base, path).orElse(null),
                    git.readIndexContent(path).orElse(null));
        });
    }

    @Override
    public CompletableFuture<Boolean> isPartiallyStaged(String path) {
        return read(CacheKey.isPartiallyStaged(path), () -> {
            var status = git.getStatus();
            return status.staged().containsKey(path) && status.unstaged().containsKey(path);
        });
    }

    @Override
    public CompletableFuture<Optional<String>> readFileFromIndex(String path) {
        return read(
                CacheKey.index(path),
                () -> git.readIndexContent(path).map(bytes -> new String(bytes, StandardCharsets.UTF_8)));
    }

    // ---- history ----

    @Override
    public CompletableFuture<Void> commit(String message, CommitOptions options) {
        var formatted = formatter.format(message);
        return mutate(
                "commit",
                INDEX_LANE,
                Operation.COMMIT,
                Scope.none(),
                () -> git.commit(formatted, options.amend(), options.allowEmpty()));
    }

    @Override
    public CompletableFuture<Void> merge(String ref) {
        return mutate("merge", INDEX_LANE, Operation.MERGE, Scope.none(), () -> git.merge(ref));
    }

    @Override
    public CompletableFuture<Void> checkout(String revision) {
        return mutate("checkout", INDEX_LANE, Operation.CHECKOUT, Scope.none(), () -> git.checkout(revision));
    }

    @Override
    public CompletableFuture<Void> abortMerge() {
        return mutate("abortMerge", INDEX_LANE, Operation.ABORT_MERGE, Scope.none(), git::abortMerge);
    }

    @Override
    public CompletableFuture<List<MergeConflict>> getMergeConflicts() {
        return read(CacheKey.MERGE_CONFLICTS, () -> {
            var conflicts = new ArrayList<MergeConflict>();
            for (var unmerged : git.getUnmergedPaths()) {
                var path = unmerged.path();
                conflicts.add(ConflictClassifier.classify(
                        unmerged, git.readCommitContent("HEAD", path), git.readWorkingTreeContent(path)));
            }
            return List.copyOf(conflicts);
        });
    }

    @Override
    public CompletableFuture<Boolean> pathHasMergeMarkers(String path) {
        return supply(() -> git.readWorkingTreeContent(path)
                .map(bytes -> MergeMarkers.hasMarkers(new String(bytes, StandardCharsets.UTF_8)))
                .orElse(false));
    }

    @Override
    public CompletableFuture<CommitInfo> getLastCommit() {
        return read(CacheKey.LAST_COMMIT, git::getHeadCommit);
    }

    @Override
    public CompletableFuture<CommitInfo> getCommit(String ref) {
        return read(CacheKey.commit(ref), () -> git.getCommit(ref));
    }

    // ---- branches and remotes ----

    @Override
    public CompletableFuture<List<Branch>> getBranches() {
        return read(CacheKey.BRANCHES, git::listBranches);
    }

    @Override
    public CompletableFuture<String> getCurrentBranch() {
        return read(CacheKey.CURRENT_BRANCH, git::getCurrentBranch);
    }

    @Override
    public CompletableFuture<List<Remote>> getRemotes() {
        return read(CacheKey.REMOTES, git::listRemotes);
    }

    @Override
    public CompletableFuture<Void> fetch(String branch) {
        return mutate("fetch", REMOTE_LANE, Operation.FETCH, Scope.branch(branch), () -> git.fetch(branch));
    }

    @Override
    public CompletableFuture<Void> pull(String branch) {
        return mutate("pull", INDEX_LANE, Operation.PULL, Scope.branch(branch), () -> git.pull(branch));
    }

    @Override
    public CompletableFuture<Void> push(String branch) {
        return mutate("push", REMOTE_LANE, Operation.PUSH, Scope.branch(branch), () -> {
            boolean tracked = git.getConfig("branch." + branch + ".remote", false).isPresent();
            git.push(branch, !tracked);
        });
    }

    @Override
    public CompletableFuture<Integer> getAheadCount(String branch) {
        return read(CacheKey.aheadCount(branch), () -> git.getAheadCount(branch));
    }

    @Override
    public CompletableFuture<Integer> getBehindCount(String branch) {
        return read(CacheKey.behindCount(branch), () -> git.getBehindCount(branch));
    }

    @Override
    public CompletableFuture<Optional<Remote>> getRemoteForBranch(String branch) {
        return getConfig("branch." + branch + ".remote", false).thenCompose(name -> {
            if (name.isEmpty()) {
                return CompletableFuture.completedFuture(Optional.<Remote>empty());
            }
            return getRemotes().thenApply(remotes -> remotes.stream()
                    .filter(r -> r.name().equals(name.get()))
                    .findFirst());
        });
    }

    // ---- discard history ----

    @Override
    public CompletableFuture<Void> discardWorkDirChangesForPaths(Collection<String> paths) {
        var copy = List.copyOf(paths);
        var scope = Scope.discard(copy, historyKey());
        return mutate("discardWorkDirChangesForPaths", INDEX_LANE, Operation.DISCARD_WORKDIR_CHANGES, scope, () -> {
            try {
                discardHistory.storeBeforeAndAfterBlobs(copy, p -> true, () -> git.restoreFromIndex(copy), null);
            } catch (IOException e) {
                throw unwrap(e);
            }
        });
    }

    @Override
    public <E extends Exception> CompletableFuture<List<DiscardSnapshot>> storeBeforeAndAfterBlobs(
            Collection<String> paths,
            Predicate<String> isSafe,
            DiscardHistoryStore.Mutation<E> mutate,
            @Nullable String groupKey) {
        var copy = List.copyOf(paths);
        var scope = Scope.discard(copy, historyKey());
        return mutate("storeBeforeAndAfterBlobs", INDEX_LANE, Operation.DISCARD_WORKDIR_CHANGES, scope, () -> {
            try {
                return discardHistory.storeBeforeAndAfterBlobs(copy, isSafe, mutate, groupKey);
            } catch (IOException e) {
                throw unwrap(e);
            }
        });
    }

    @Override
    public CompletableFuture<String> createDiscardHistoryBlob() {
        return supply(() -> {
            try {
                return discardHistory.createDiscardHistoryBlob();
            } catch (IOException e) {
                throw unwrap(e);
            }
        });
    }

    /** Runs a history change that ends by persisting the history under its config key. */
    private CompletableFuture<Void> persistHistory(String operation, HistoryAction action) {
        return mutate(operation, INDEX_LANE, Operation.PERSIST_DISCARD_HISTORY, Scope.configKey(historyKey()), () -> {
            try {
                action.run();
            } catch (IOException e) {
                throw unwrap(e);
            }
        });
    }

    @FunctionalInterface
    private interface HistoryAction {
        void run() throws IOException;
    }

    @Override
    public CompletableFuture<Void> updateDiscardHistory() {
        return persistHistory("updateDiscardHistory", discardHistory::updateDiscardHistory);
    }

    @Override
    public CompletableFuture<List<List<DiscardSnapshot>>> getDiscardHistory(@Nullable String groupKey) {
        return CompletableFuture.completedFuture(discardHistory.getDiscardHistory(groupKey));
    }

    @Override
    public CompletableFuture<Boolean> hasDiscardHistory(@Nullable String groupKey) {
        return CompletableFuture.completedFuture(discardHistory.hasDiscardHistory(groupKey));
    }

    @Override
    public CompletableFuture<List<DiscardSnapshot>> getLastHistorySnapshots(@Nullable String groupKey) {
        return CompletableFuture.completedFuture(discardHistory.getLastHistorySnapshots(groupKey));
    }

    @Override
    public CompletableFuture<Void> popDiscardHistory(@Nullable String groupKey) {
        return persistHistory("popDiscardHistory", () -> discardHistory.popDiscardHistory(groupKey));
    }

    @Override
    public CompletableFuture<Void> clearDiscardHistory(@Nullable String groupKey) {
        return persistHistory("clearDiscardHistory", () -> discardHistory.clearDiscardHistory(groupKey));
    }

    @Override
    public CompletableFuture<List<String>> undoLastDiscard(@Nullable String groupKey) {
        return submit("undoLastDiscard", INDEX_LANE, () -> {
            // the entry to undo is only known once earlier discards on this lane have finished
            var paths = discardHistory.getLastHistorySnapshots(groupKey).stream()
                    .map(DiscardSnapshot::filePath)
                    .toList();
            try {
                return discardHistory.undoLastDiscard(groupKey);
            } catch (IOException e) {
                throw unwrap(e);
            } finally {
                cache.invalidate(
                        InvalidationTable.keysFor(Operation.UNDO_DISCARD, Scope.discard(paths, historyKey())));
            }
        });
    }

    /** Git failures reach the discard store wrapped in IOException; hand the original back to the caller. */
    private static Exception unwrap(IOException e) {
        if (e.getCause() instanceof GitAPIException cause) {
            return cause;
        }
        return e;
    }

    // ---- config ----

    @Override
    public CompletableFuture<Optional<String>> getConfig(String key, boolean local) {
        return read(CacheKey.config(key, local), () -> git.getConfig(key, local));
    }

    @Override
    public CompletableFuture<Void> setConfig(String key, String value) {
        return mutate(
                "setConfig", CONFIG_LANE, Operation.SET_CONFIG, Scope.configKey(key), () -> git.setConfig(key, value));
    }

    @Override
    public CompletableFuture<Void> unsetConfig(String key) {
        return mutate(
                "unsetConfig", CONFIG_LANE, Operation.UNSET_CONFIG, Scope.configKey(key), () -> git.unsetConfig(key));
    }

    @Override
    public String toString() {
        return "Present[" + Objects.requireNonNull(repository.getWorkingDirectoryPath()) + "]";
    }
}
