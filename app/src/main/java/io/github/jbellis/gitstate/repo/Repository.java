package io.github.jbellis.gitstate.repo;

import io.github.jbellis.gitstate.cache.Cache;
import io.github.jbellis.gitstate.conflict.MergeConflict;
import io.github.jbellis.gitstate.discard.DiscardHistoryStore;
import io.github.jbellis.gitstate.discard.DiscardSnapshot;
import io.github.jbellis.gitstate.git.Branch;
import io.github.jbellis.gitstate.git.ChangedFile;
import io.github.jbellis.gitstate.git.CommitInfo;
import io.github.jbellis.gitstate.git.ConflictSide;
import io.github.jbellis.gitstate.git.GitRepo;
import io.github.jbellis.gitstate.git.GitRepoFactory;
import io.github.jbellis.gitstate.git.IGitRepo;
import io.github.jbellis.gitstate.git.Remote;
import io.github.jbellis.gitstate.git.WorkingTreeStatus;
import io.github.jbellis.gitstate.patch.FilePatch;
import io.github.jbellis.gitstate.util.ExecutorServiceUtil;
import io.github.jbellis.gitstate.util.GitStateSettings;
import io.github.jbellis.gitstate.util.SerialTaskQueue;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import java.util.function.Predicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Stateful, cached view of a git working directory.
 *
 * <p>An instance created with a path starts in {@code Loading} and moves to {@code Present} or {@code Absent} once it
 * knows whether the directory holds a repository. Every operation is forwarded to the current
 * {@link RepositoryState}. Reads are cached until an operation that can change them runs or {@link #refresh()} is
 * called; see {@link io.github.jbellis.gitstate.cache.InvalidationTable}.
 *
 * <p>Each instance owns an executor, a serial queue for index mutations, the cache and the discard history. All of
 * them are released by {@link #destroy()}, after which every operation fails with {@link NotReadyException}.
 */
public class Repository implements RepositoryOperations, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(Repository.class);

    @Nullable
    private final Path workingDirectory;
    private final GitStateSettings settings;
    private final Cache cache = new Cache();
    private final ExecutorService executor;
    private final SerialTaskQueue queue;

    private volatile RepositoryState state;
    private volatile CompletableFuture<Void> loadPromise = new CompletableFuture<>();

    /** Opens {@code workingDirectory} with the default settings. */
    public Repository(Path workingDirectory) {
        this(workingDirectory, GitStateSettings.load());
    }

    public Repository(Path workingDirectory, GitStateSettings settings) {
        this(workingDirectory, settings, repo -> new LoadingState(repo, repo.loadPromise));
        var dir = workingDirectory;
        startLoading(() -> GitRepoFactory.hasGitRepo(dir) ? new GitRepo(dir, settings) : null, false);
    }

    private Repository(
            @Nullable Path workingDirectory,
            GitStateSettings settings,
            Function<Repository, RepositoryState> initialState) {
        this.workingDirectory = workingDirectory;
        this.settings = settings;
        this.executor = ExecutorServiceUtil.newRepositoryExecutor(workingDirectory, settings.executorThreads());
        this.queue = new SerialTaskQueue(executor, ExecutorServiceUtil.threadPrefix(workingDirectory) + "queue");
        this.state = initialState.apply(this);
    }

    /** A repository known to be absent, with no working directory. */
    public static Repository absent() {
        return new Repository(null, GitStateSettings.load(), AbsentState::new);
    }

    /** A placeholder for a repository that is probably absent. */
    public static Repository absentGuess() {
        return new Repository(null, GitStateSettings.load(), AbsentGuessState::new);
    }

    /** A placeholder for a repository that is probably about to load. */
    public static Repository loadingGuess() {
        return new Repository(null, GitStateSettings.load(), repo -> new LoadingGuessState(repo, repo.loadPromise));
    }

    // ---- lifecycle ----

    /**
     * Moves to {@code Loading} and opens (or creates) the repository with {@code opener} on the executor. A null
     * result means there is no repository. The returned future completes once the instance has left
     * {@code Loading}; it fails with the opener's exception, in which case the instance ends up {@code Absent}.
     */
    CompletableFuture<Void> load(Callable<@Nullable IGitRepo> opener) {
        return startLoading(opener, true);
    }

    private CompletableFuture<Void> startLoading(Callable<@Nullable IGitRepo> opener, boolean propagateFailure) {
        CompletableFuture<Void> promise;
        synchronized (this) {
            if (state.isDestroyed()) {
                return CompletableFuture.failedFuture(new NotReadyException(state.name(), "load"));
            }
            if (state instanceof LoadingState loading) {
                promise = loading.getLoadPromise();
            } else {
                // publish the promise before the state that waits on it
                promise = new CompletableFuture<>();
                loadPromise = promise;
                transitionTo(new LoadingState(this, promise));
            }
        }

        var result = new CompletableFuture<Void>();
        try {
            executor.execute(() -> {
                IGitRepo git = null;
                Throwable failure = null;
                try {
                    git = opener.call();
                } catch (Throwable t) {
                    failure = t;
                    if (propagateFailure) {
                        logger.debug("Could not create repository at {}: {}", workingDirectory, t.toString());
                    } else {
                        logger.error("Could not open repository at {}", workingDirectory, t);
                    }
                }
                finishLoading(git);
                promise.complete(null);
                if (failure != null && propagateFailure) {
                    result.completeExceptionally(failure);
                } else {
                    result.complete(null);
                }
            });
        } catch (RejectedExecutionException e) {
            promise.complete(null);
            result.completeExceptionally(new NotReadyException(state.name(), "load"));
        }
        return result;
    }

    private void finishLoading(@Nullable IGitRepo git) {
        if (git == null) {
            synchronized (this) {
                if (!state.isDestroyed()) {
                    transitionTo(new AbsentState(this));
                }
            }
            return;
        }

        var history = new DiscardHistoryStore(
                new GitContentStore(git), settings.discardHistoryConfigKey(), settings.discardHistoryMaxLength());
        history.restoreHistory();
        synchronized (this) {
            if (!state.isDestroyed()) {
                transitionTo(new PresentState(this, git, history));
                return;
            }
        }
        // destroyed while loading
        git.close();
    }

    private void transitionTo(RepositoryState next) {
        assert Thread.holdsLock(this);
        logger.debug("{}: {} -> {}", workingDirectory, state.name(), next.name());
        state = next;
    }

    /**
     * Releases the cache, the discard history, the queue and the executor, and moves to {@code Destroyed}. Calls
     * waiting for loading to finish are woken up and fail.
     */
    public void destroy() {
        RepositoryState previous;
        CompletableFuture<Void> pending;
        synchronized (this) {
            if (state.isDestroyed()) {
                return;
            }
            previous = state;
            transitionTo(new DestroyedState(this));
            pending = loadPromise;
        }
        queue.close();
        cache.clear();
        pending.complete(null);
        executor.shutdown();
        if (previous instanceof PresentState present) {
            present.getGit().close();
        }
    }

    @Override
    public void close() {
        destroy();
    }

    /** Forgets every cached read. */
    public void refresh() {
        logger.debug("Refreshing {}", workingDirectory);
        cache.clear();
    }

    /** Completes when the instance leaves {@code Loading} (or {@code LoadingGuess}). Never fails. */
    public CompletableFuture<Void> getLoadPromise() {
        return loadPromise;
    }

    public boolean isInState(String stateName) {
        return state.name().equals(stateName);
    }

    public RepositoryState getState() {
        return state;
    }

    public boolean isLoading() {
        return state.isLoading();
    }

    public boolean isPresent() {
        return state.isPresent();
    }

    public boolean isAbsent() {
        return state.isAbsent();
    }

    public boolean isEmpty() {
        return state.isEmpty();
    }

    public boolean isDestroyed() {
        return state.isDestroyed();
    }

    public boolean showGitTabLoading() {
        return state.showGitTabLoading();
    }

    public boolean showGitTabInit() {
        return state.showGitTabInit();
    }

    public @Nullable Path getWorkingDirectoryPath() {
        return workingDirectory;
    }

    /** The underlying git collaborator while {@code Present}; calls made through it bypass the cache. */
    public Optional<IGitRepo> getGitRepo() {
        return state instanceof PresentState present ? Optional.of(present.getGit()) : Optional.empty();
    }

    GitStateSettings getSettings() {
        return settings;
    }

    Cache getCache() {
        return cache;
    }

    SerialTaskQueue getQueue() {
        return queue;
    }

    ExecutorService getExecutor() {
        return executor;
    }

    // ---- convenience overloads ----

    public CompletableFuture<Optional<FilePatch>> getFilePatchForPath(String path) {
        return getFilePatchForPath(path, FilePatchOptions.UNSTAGED);
    }

    public CompletableFuture<Void> checkoutPathsAtRevision(Collection<String> paths) {
        return checkoutPathsAtRevision(paths, "HEAD");
    }

    public CompletableFuture<Void> commit(String message) {
        return commit(message, CommitOptions.DEFAULT);
    }

    public CompletableFuture<Optional<String>> getConfig(String key) {
        return getConfig(key, false);
    }

    // ---- operations, forwarded to the current state ----

    @Override
    public CompletableFuture<Void> init() {
        return state.init();
    }

    @Override
    public CompletableFuture<Void> clone(String url) {
        return state.clone(url);
    }

    @Override
    public CompletableFuture<Boolean> isMerging() {
        return state.isMerging();
    }

    @Override
    public CompletableFuture<Void> stageFiles(Collection<String> paths) {
        return state.stageFiles(paths);
    }

    @Override
    public CompletableFuture<Void> unstageFiles(Collection<String> paths) {
        return state.unstageFiles(paths);
    }

    @Override
    public CompletableFuture<Void> stageFilesFromParentCommit(Collection<String> paths) {
        return state.stageFilesFromParentCommit(paths);
    }

    @Override
    public CompletableFuture<Void> applyPatchToIndex(FilePatch patch) {
        return state.applyPatchToIndex(patch);
    }

    @Override
    public CompletableFuture<Void> applyPatchToWorkdir(FilePatch patch) {
        return state.applyPatchToWorkdir(patch);
    }

    @Override
    public CompletableFuture<Void> checkoutSide(ConflictSide side, Collection<String> paths) {
        return state.checkoutSide(side, paths);
    }

    @Override
    public CompletableFuture<WorkingTreeStatus> getStatusesForChangedFiles() {
        return state.getStatusesForChangedFiles();
    }

    @Override
    public CompletableFuture<List<ChangedFile>> getUnstagedChanges() {
        return state.getUnstagedChanges();
    }

    @Override
    public CompletableFuture<List<ChangedFile>> getStagedChanges() {
        return state.getStagedChanges();
    }

    @Override
    public CompletableFuture<List<ChangedFile>> getStagedChangesSinceParentCommit() {
        return state.getStagedChangesSinceParentCommit();
    }

    @Override
    public CompletableFuture<Optional<FilePatch>> getFilePatchForPath(String path, FilePatchOptions options) {
        return state.getFilePatchForPath(path, options);
    }

    @Override
    public CompletableFuture<Boolean> isPartiallyStaged(String path) {
        return state.isPartiallyStaged(path);
    }

    @Override
    public CompletableFuture<Optional<String>> readFileFromIndex(String path) {
        return state.readFileFromIndex(path);
    }

    @Override
    public CompletableFuture<Void> commit(String message, CommitOptions options) {
        return state.commit(message, options);
    }

    @Override
    public CompletableFuture<Void> merge(String ref) {
        return state.merge(ref);
    }

    @Override
    public CompletableFuture<Void> writeMergeConflictToIndex(
            String path, @Nullable String baseId, @Nullable String oursId, @Nullable String theirsId) {
        return state.writeMergeConflictToIndex(path, baseId, oursId, theirsId);
    }

    @Override
    public CompletableFuture<Void> checkoutPathsAtRevision(Collection<String> paths, String revision) {
        return state.checkoutPathsAtRevision(paths, revision);
    }

    @Override
    public CompletableFuture<Void> checkout(String revision) {
        return state.checkout(revision);
    }

    @Override
    public CompletableFuture<Void> abortMerge() {
        return state.abortMerge();
    }

    @Override
    public CompletableFuture<List<MergeConflict>> getMergeConflicts() {
        return state.getMergeConflicts();
    }

    @Override
    public CompletableFuture<Boolean> pathHasMergeMarkers(String path) {
        return state.pathHasMergeMarkers(path);
    }

    @Override
    public CompletableFuture<CommitInfo> getLastCommit() {
        return state.getLastCommit();
    }

    @Override
    public CompletableFuture<CommitInfo> getCommit(String ref) {
        return state.getCommit(ref);
    }

    @Override
    public CompletableFuture<List<Branch>> getBranches() {
        return state.getBranches();
    }

    @Override
    public CompletableFuture<String> getCurrentBranch() {
        return state.getCurrentBranch();
    }

    @Override
    public CompletableFuture<List<Remote>> getRemotes() {
        return state.getRemotes();
    }

    @Override
    public CompletableFuture<Void> fetch(String branch) {
        return state.fetch(branch);
    }

    @Override
    public CompletableFuture<Void> pull(String branch) {
        return state.pull(branch);
    }

    @Override
    public CompletableFuture<Void> push(String branch) {
        return state.push(branch);
    }

    @Override
    public CompletableFuture<Integer> getAheadCount(String branch) {
        return state.getAheadCount(branch);
    }

    @Override
    public CompletableFuture<Integer> getBehindCount(String branch) {
        return state.getBehindCount(branch);
    }

    @Override
    public CompletableFuture<Optional<Remote>> getRemoteForBranch(String branch) {
        return state.getRemoteForBranch(branch);
    }

    @Override
    public CompletableFuture<Void> discardWorkDirChangesForPaths(Collection<String> paths) {
        return state.discardWorkDirChangesForPaths(paths);
    }

    @Override
    public <E extends Exception> CompletableFuture<List<DiscardSnapshot>> storeBeforeAndAfterBlobs(
            Collection<String> paths,
            Predicate<String> isSafe,
            DiscardHistoryStore.Mutation<E> mutate,
            @Nullable String groupKey) {
        return state.storeBeforeAndAfterBlobs(paths, isSafe, mutate, groupKey);
    }

    @Override
    public CompletableFuture<String> createDiscardHistoryBlob() {
        return state.createDiscardHistoryBlob();
    }

    @Override
    public CompletableFuture<Void> updateDiscardHistory() {
        return state.updateDiscardHistory();
    }

    @Override
    public CompletableFuture<List<List<DiscardSnapshot>>> getDiscardHistory(@Nullable String groupKey) {
        return state.getDiscardHistory(groupKey);
    }

    @Override
    public CompletableFuture<Boolean> hasDiscardHistory(@Nullable String groupKey) {
        return state.hasDiscardHistory(groupKey);
    }

    @Override
    public CompletableFuture<List<DiscardSnapshot>> getLastHistorySnapshots(@Nullable String groupKey) {
        return state.getLastHistorySnapshots(groupKey);
    }

    @Override
    public CompletableFuture<Void> popDiscardHistory(@Nullable String groupKey) {
        return state.popDiscardHistory(groupKey);
    }

    @Override
    public CompletableFuture<Void> clearDiscardHistory(@Nullable String groupKey) {
        return state.clearDiscardHistory(groupKey);
    }

    @Override
    public CompletableFuture<List<String>> undoLastDiscard(@Nullable String groupKey) {
        return state.undoLastDiscard(groupKey);
    }

    @Override
    public CompletableFuture<Optional<String>> getConfig(String key, boolean local) {
        return state.getConfig(key, local);
    }

    @Override
    public CompletableFuture<Void> setConfig(String key, String value) {
        return state.setConfig(key, value);
    }

    @Override
    public CompletableFuture<Void> unsetConfig(String key) {
        return state.unsetConfig(key);
    }

    @Override
    public String toString() {
        return "Repository[" + workingDirectory + ", " + state.name() + "]";
    }
}
