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
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;

/** A state without repository content: every operation fails with {@link NotReadyException}. */
abstract sealed class UnavailableState implements RepositoryState
        permits AbsentState, AbsentGuessState, DestroyedState {
    protected final Repository repository;

    UnavailableState(Repository repository) {
        this.repository = repository;
    }

    protected <T> CompletableFuture<T> notReady(String operation) {
        return CompletableFuture.failedFuture(new NotReadyException(name(), operation));
    }

    @Override
    public CompletableFuture<Void> init() {
        return notReady("init");
    }

    @Override
    public CompletableFuture<Void> clone(String url) {
        return notReady("clone");
    }

    @Override
    public CompletableFuture<Boolean> isMerging() {
        return notReady("isMerging");
    }

    @Override
    public CompletableFuture<Void> stageFiles(Collection<String> paths) {
        return notReady("stageFiles");
    }

    @Override
    public CompletableFuture<Void> unstageFiles(Collection<String> paths) {
        return notReady("unstageFiles");
    }

    @Override
    public CompletableFuture<Void> stageFilesFromParentCommit(Collection<String> paths) {
        return notReady("stageFilesFromParentCommit");
    }

    @Override
    public CompletableFuture<Void> applyPatchToIndex(FilePatch patch) {
        return notReady("applyPatchToIndex");
    }

    @Override
    public CompletableFuture<Void> applyPatchToWorkdir(FilePatch patch) {
        return notReady("applyPatchToWorkdir");
    }

    @Override
    public CompletableFuture<Void> checkoutSide(ConflictSide side, Collection<String> paths) {
        return notReady("checkoutSide");
    }

    @Override
    public CompletableFuture<WorkingTreeStatus> getStatusesForChangedFiles() {
        return notReady("getStatusesForChangedFiles");
    }

    @Override
    public CompletableFuture<List<ChangedFile>> getUnstagedChanges() {
        return notReady("getUnstagedChanges");
    }

    @Override
    public CompletableFuture<List<ChangedFile>> getStagedChanges() {
        return notReady("getStagedChanges");
    }

    @Override
    public CompletableFuture<List<ChangedFile>> getStagedChangesSinceParentCommit() {
        return notReady("getStagedChangesSinceParentCommit");
    }

    @Override
    public CompletableFuture<Optional<FilePatch>> getFilePatchForPath(String path, FilePatchOptions options) {
        return notReady("getFilePatchForPath");
    }

    @Override
    public CompletableFuture<Boolean> isPartiallyStaged(String path) {
        return notReady("isPartiallyStaged");
    }

    @Override
    public CompletableFuture<Optional<String>> readFileFromIndex(String path) {
        return notReady("readFileFromIndex");
    }

    @Override
    public CompletableFuture<Void> commit(String message, CommitOptions options) {
        return notReady("commit");
    }

    @Override
    public CompletableFuture<Void> merge(String ref) {
        return notReady("merge");
    }

    @Override
    public CompletableFuture<Void> writeMergeConflictToIndex(
            String path, @Nullable String baseId, @Nullable String oursId, @Nullable String theirsId) {
        return notReady("writeMergeConflictToIndex");
    }

    @Override
    public CompletableFuture<Void> checkoutPathsAtRevision(Collection<String> paths, String revision) {
        return notReady("checkoutPathsAtRevision");
    }

    @Override
    public CompletableFuture<Void> checkout(String revision) {
        return notReady("checkout");
    }

    @Override
    public CompletableFuture<Void> abortMerge() {
        return notReady("abortMerge");
    }

    @Override
    public CompletableFuture<List<MergeConflict>> getMergeConflicts() {
        return notReady("getMergeConflicts");
    }

    @Override
    public CompletableFuture<Boolean> pathHasMergeMarkers(String path) {
        return notReady("pathHasMergeMarkers");
    }

    @Override
    public CompletableFuture<CommitInfo> getLastCommit() {
        return notReady("getLastCommit");
    }

    @Override
    public CompletableFuture<CommitInfo> getCommit(String ref) {
        return notReady("getCommit");
    }

    @Override
    public CompletableFuture<List<Branch>> getBranches() {
        return notReady("getBranches");
    }

    @Override
    public CompletableFuture<String> getCurrentBranch() {
        return notReady("getCurrentBranch");
    }

    @Override
    public CompletableFuture<List<Remote>> getRemotes() {
        return notReady("getRemotes");
    }

    @Override
    public CompletableFuture<Void> fetch(String branch) {
        return notReady("fetch");
    }

    @Override
    public CompletableFuture<Void> pull(String branch) {
        return notReady("pull");
    }

    @Override
    public CompletableFuture<Void> push(String branch) {
        return notReady("push");
    }

    @Override
    public CompletableFuture<Integer> getAheadCount(String branch) {
        return notReady("getAheadCount");
    }

    @Override
    public CompletableFuture<Integer> getBehindCount(String branch) {
        return notReady("getBehindCount");
    }

    @Override
    public CompletableFuture<Optional<Remote>> getRemoteForBranch(String branch) {
        return notReady("getRemoteForBranch");
    }

    @Override
    public CompletableFuture<Void> discardWorkDirChangesForPaths(Collection<String> paths) {
        return notReady("discardWorkDirChangesForPaths");
    }

    @Override
    public <E extends Exception> CompletableFuture<List<DiscardSnapshot>> storeBeforeAndAfterBlobs(
            Collection<String> paths,
            Predicate<String> isSafe,
            DiscardHistoryStore.Mutation<E> mutate,
            @Nullable String groupKey) {
        return notReady("storeBeforeAndAfterBlobs");
    }

    @Override
    public CompletableFuture<String> createDiscardHistoryBlob() {
        return notReady("createDiscardHistoryBlob");
    }

    @Override
    public CompletableFuture<Void> updateDiscardHistory() {
        return notReady("updateDiscardHistory");
    }

    @Override
    public CompletableFuture<List<List<DiscardSnapshot>>> getDiscardHistory(@Nullable String groupKey) {
        return notReady("getDiscardHistory");
    }

    @Override
    public CompletableFuture<Boolean> hasDiscardHistory(@Nullable String groupKey) {
        return notReady("hasDiscardHistory");
    }

    @Override
    public CompletableFuture<List<DiscardSnapshot>> getLastHistorySnapshots(@Nullable String groupKey) {
        return notReady("getLastHistorySnapshots");
    }

    @Override
    public CompletableFuture<Void> popDiscardHistory(@Nullable String groupKey) {
        return notReady("popDiscardHistory");
    }

    @Override
    public CompletableFuture<Void> clearDiscardHistory(@Nullable String groupKey) {
        return notReady("clearDiscardHistory");
    }

    @Override
    public CompletableFuture<List<String>> undoLastDiscard(@Nullable String groupKey) {
        return notReady("undoLastDiscard");
    }

    @Override
    public CompletableFuture<Optional<String>> getConfig(String key, boolean local) {
        return notReady("getConfig");
    }

    @Override
    public CompletableFuture<Void> setConfig(String key, String value) {
        return notReady("setConfig");
    }

    @Override
    public CompletableFuture<Void> unsetConfig(String key) {
        return notReady("unsetConfig");
    }
}
