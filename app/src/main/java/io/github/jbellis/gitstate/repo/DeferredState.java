package io.github.jbellis.gitstate.repo;

import io.github.jbellis.gitstate.conflict.MergeConflict;
import io.github.jbellis.gitstate.discard.DiscardHistoryStore;
import io.github.jbellis.gitstate.discard.DiscardSnapshot;
import io.github.jbellis.gitstate.git.Branch;
import io.github.jbellis.gitstate.git.ChangedFile;
import io.github.jbellis.gitstate.git.CommitInfo;
import io.github.jbellis.gitstate.git.ConflictSide;
import io.github.jbellis.gitstate.git.Remote;
import io.github.jbellis.gitstate.git.WorkingTreeStatus;
import io.github.jbellis.gitstate.patch.FilePatch;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Predicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * A state that does not know yet whether the working directory holds a repository. Every operation waits for the
 * current load to finish and is then handed to the state the repository reached, so calls made while loading run
 * (or fail) exactly as if they had been made afterwards.
 */
abstract sealed class DeferredState implements RepositoryState permits LoadingState, LoadingGuessState {
    private static final Logger logger = LogManager.getLogger(DeferredState.class);

    protected final Repository repository;
    private final CompletableFuture<Void> loadPromise;

    /** @param loadPromise completes when the load this state stands for has finished */
    DeferredState(Repository repository, CompletableFuture<Void> loadPromise) {
        this.repository = repository;
        this.loadPromise = loadPromise;
    }

    CompletableFuture<Void> getLoadPromise() {
        return loadPromise;
    }

    @Override
    public boolean isLoading() {
        return true;
    }

    @Override
    public boolean showGitTabLoading() {
        return true;
    }

    private <T> CompletableFuture<T> afterLoad(String operation, Function<RepositoryState, CompletableFuture<T>> call) {
        logger.trace("{} waiting for {} to finish loading", operation, repository);
        return loadPromise.thenCompose(ignored -> {
            var next = repository.getState();
            if (next == this) {
                return CompletableFuture.failedFuture(new NotReadyException(name(), operation));
            }
            return call.apply(next);
        });
    }

    @Override
    public CompletableFuture<Void> init() {
        return afterLoad("init", s -> s.init());
    }

    @Override
    public CompletableFuture<Void> clone(String url) {
        return afterLoad("clone", s -> s.clone(url));
    }

    @Override
    public CompletableFuture<Boolean> isMerging() {
        return afterLoad("isMerging", s -> s.isMerging());
    }

    @Override
    public CompletableFuture<Void> stageFiles(Collection<String> paths) {
        return afterLoad("stageFiles", s -> s.stageFiles(paths));
    }

    @Override
    public CompletableFuture<Void> unstageFiles(Collection<String> paths) {
        return afterLoad("unstageFiles", s -> s.unstageFiles(paths));
    }

    @Override
    public CompletableFuture<Void> stageFilesFromParentCommit(Collection<String> paths) {
        return afterLoad("stageFilesFromParentCommit", s -> s.stageFilesFromParentCommit(paths));
    }

    @Override
    public CompletableFuture<Void> applyPatchToIndex(FilePatch patch) {
        return afterLoad("applyPatchToIndex", s -> s.applyPatchToIndex(patch));
    }

    @Override
    public CompletableFuture<Void> applyPatchToWorkdir(FilePatch patch) {
        return afterLoad("applyPatchToWorkdir", s -> s.applyPatchToWorkdir(patch));
    }

    @Override
    public CompletableFuture<Void> checkoutSide(ConflictSide side, Collection<String> paths) {
        return afterLoad("checkoutSide", s -> s.checkoutSide(side, paths));
    }

    @Override
    public CompletableFuture<WorkingTreeStatus> getStatusesForChangedFiles() {
        return afterLoad("getStatusesForChangedFiles", s -> s.getStatusesForChangedFiles());
    }

    @Override
    public CompletableFuture<List<ChangedFile>> getUnstagedChanges() {
        return afterLoad("getUnstagedChanges", s -> s.getUnstagedChanges());
    }

    @Override
    public CompletableFuture<List<ChangedFile>> getStagedChanges() {
        return afterLoad("getStagedChanges", s -> s.getStagedChanges());
    }

    @Override
    public CompletableFuture<List<ChangedFile>> getStagedChangesSinceParentCommit() {
        return afterLoad("getStagedChangesSinceParentCommit", s -> s.getStagedChangesSinceParentCommit());
    }

    @Override
    public CompletableFuture<Optional<FilePatch>> getFilePatchForPath(String path, FilePatchOptions options) {
        return afterLoad("getFilePatchForPath", s -> s.getFilePatchForPath(path, options));
    }

    @Override
    public CompletableFuture<Boolean> isPartiallyStaged(String path) {
        return afterLoad("isPartiallyStaged", s -> s.isPartiallyStaged(path));
    }

    @Override
    public CompletableFuture<Optional<String>> readFileFromIndex(String path) {
        return afterLoad("readFileFromIndex", s -> s.readFileFromIndex(path));
    }

    @Override
    public CompletableFuture<Void> commit(String message, CommitOptions options) {
        return afterLoad("commit", s -> s.commit(message, options));
    }

    @Override
    public CompletableFuture<Void> merge(String ref) {
        return afterLoad("merge", s -> s.merge(ref));
    }

    @Override
    public CompletableFuture<Void> writeMergeConflictToIndex(
            String path, @Nullable String baseId, @Nullable String oursId, @Nullable String theirsId) {
        return afterLoad("writeMergeConflictToIndex", s -> s.writeMergeConflictToIndex(path, baseId, oursId, theirsId));
    }

    @Override
    public CompletableFuture<Void> checkoutPathsAtRevision(Collection<String> paths, String revision) {
        return afterLoad("checkoutPathsAtRevision", s -> s.checkoutPathsAtRevision(paths, revision));
    }

    @Override
    public CompletableFuture<Void> checkout(String revision) {
        return afterLoad("checkout", s -> s.checkout(revision));
    }

    @Override
    public CompletableFuture<Void> abortMerge() {
        return afterLoad("abortMerge", s -> s.abortMerge());
    }

    @Override
    public CompletableFuture<List<MergeConflict>> getMergeConflicts() {
        return afterLoad("getMergeConflicts", s -> s.getMergeConflicts());
    }

    @Override
    public CompletableFuture<Boolean> pathHasMergeMarkers(String path) {
        return afterLoad("pathHasMergeMarkers", s -> s.pathHasMergeMarkers(path));
    }

    @Override
    public CompletableFuture<CommitInfo> getLastCommit() {
        return afterLoad("getLastCommit", s -> s.getLastCommit());
    }

    @Override
    public CompletableFuture<CommitInfo> getCommit(String ref) {
        return afterLoad("getCommit", s -> s.getCommit(ref));
    }

    @Override
    public CompletableFuture<List<Branch>> getBranches() {
        return afterLoad("getBranches", s -> s.getBranches());
    }

    @Override
    public CompletableFuture<String> getCurrentBranch() {
        return afterLoad("getCurrentBranch", s -> s.getCurrentBranch());
    }

    @Override
    public CompletableFuture<List<Remote>> getRemotes() {
        return afterLoad("getRemotes", s -> s.getRemotes());
    }

    @Override
    public CompletableFuture<Void> fetch(String branch) {
        return afterLoad("fetch", s -> s.fetch(branch));
    }

    @Override
    public CompletableFuture<Void> pull(String branch) {
        return afterLoad("pull", s -> s.pull(branch));
    }

    @Override
    public CompletableFuture<Void> push(String branch) {
        return afterLoad("push", s -> s.push(branch));
    }

    @Override
    public CompletableFuture<Integer> getAheadCount(String branch) {
        return afterLoad("getAheadCount", s -> s.getAheadCount(branch));
    }

    @Override
    public CompletableFuture<Integer> getBehindCount(String branch) {
        return afterLoad("getBehindCount", s -> s.getBehindCount(branch));
    }

    @Override
    public CompletableFuture<Optional<Remote>> getRemoteForBranch(String branch) {
        return afterLoad("getRemoteForBranch", s -> s.getRemoteForBranch(branch));
    }

    @Override
    public CompletableFuture<Void> discardWorkDirChangesForPaths(Collection<String> paths) {
        return afterLoad("discardWorkDirChangesForPaths", s -> s.discardWorkDirChangesForPaths(paths));
    }

    @Override
    public <E extends Exception> CompletableFuture<List<DiscardSnapshot>> storeBeforeAndAfterBlobs(
            Collection<String> paths,
            Predicate<String> isSafe,
            DiscardHistoryStore.Mutation<E> mutate,
            @Nullable String groupKey) {
        return afterLoad(
                "storeBeforeAndAfterBlobs", s -> s.storeBeforeAndAfterBlobs(paths, isSafe, mutate, groupKey));
    }

    @Override
    public CompletableFuture<String> createDiscardHistoryBlob() {
        return afterLoad("createDiscardHistoryBlob", s -> s.createDiscardHistoryBlob());
    }

    @Override
    public CompletableFuture<Void> updateDiscardHistory() {
        return afterLoad("updateDiscardHistory", s -> s.updateDiscardHistory());
    }

    @Override
    public CompletableFuture<List<List<DiscardSnapshot>>> getDiscardHistory(@Nullable String groupKey) {
        return afterLoad("getDiscardHistory", s -> s.getDiscardHistory(groupKey));
    }

    @Override
    public CompletableFuture<Boolean> hasDiscardHistory(@Nullable String groupKey) {
        return afterLoad("hasDiscardHistory", s -> s.hasDiscardHistory(groupKey));
    }

    @Override
    public CompletableFuture<List<DiscardSnapshot>> getLastHistorySnapshots(@Nullable String groupKey) {
        return afterLoad("getLastHistorySnapshots", s -> s.getLastHistorySnapshots(groupKey));
    }

    @Override
    public CompletableFuture<Void> popDiscardHistory(@Nullable String groupKey) {
        return afterLoad("popDiscardHistory", s -> s.popDiscardHistory(groupKey));
    }

    @Override
    public CompletableFuture<Void> clearDiscardHistory(@Nullable String groupKey) {
        return afterLoad("clearDiscardHistory", s -> s.clearDiscardHistory(groupKey));
    }

    @Override
    public CompletableFuture<List<String>> undoLastDiscard(@Nullable String groupKey) {
        return afterLoad("undoLastDiscard", s -> s.undoLastDiscard(groupKey));
    }

    @Override
    public CompletableFuture<Optional<String>> getConfig(String key, boolean local) {
        return afterLoad("getConfig", s -> s.getConfig(key, local));
    }

    @Override
    public CompletableFuture<Void> setConfig(String key, String value) {
        return afterLoad("setConfig", s -> s.setConfig(key, value));
    }

    @Override
    public CompletableFuture<Void> unsetConfig(String key) {
        return afterLoad("unsetConfig", s -> s.unsetConfig(key));
    }
}
