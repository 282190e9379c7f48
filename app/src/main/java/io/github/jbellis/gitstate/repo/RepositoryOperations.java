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

/**
 * The asynchronous operations of a repository. Every lifecycle state implements all of them; what an operation does
 * depends on the state it reaches.
 *
 * <p>Mutating operations complete after the cached reads they affect have been invalidated.
 */
public interface RepositoryOperations {

    // ---- lifecycle ----

    /** Creates an empty repository in the working directory. */
    CompletableFuture<Void> init();

    /** Clones {@code url} into the working directory, which must be empty or missing. */
    CompletableFuture<Void> clone(String url);

    CompletableFuture<Boolean> isMerging();

    // ---- index ----

    CompletableFuture<Void> stageFiles(Collection<String> paths);

    CompletableFuture<Void> unstageFiles(Collection<String> paths);

    /** Sets the index entries of {@code paths} to their content in HEAD's parent. */
    CompletableFuture<Void> stageFilesFromParentCommit(Collection<String> paths);

    CompletableFuture<Void> applyPatchToIndex(FilePatch patch);

    CompletableFuture<Void> applyPatchToWorkdir(FilePatch patch);

    CompletableFuture<Void> checkoutSide(ConflictSide side, Collection<String> paths);

    /**
     * Replaces the index entries of {@code path} with conflict stages built from blob ids: 1 for the common base, 2
     * for ours and 3 for theirs. A null id leaves that stage out.
     */
    CompletableFuture<Void> writeMergeConflictToIndex(
            String path, @Nullable String baseId, @Nullable String oursId, @Nullable String theirsId);

    /** Sets both the index entries and the working tree files of {@code paths} to their content at {@code revision}. */
    CompletableFuture<Void> checkoutPathsAtRevision(Collection<String> paths, String revision);

    // ---- status and content ----

    CompletableFuture<WorkingTreeStatus> getStatusesForChangedFiles();

    CompletableFuture<List<ChangedFile>> getUnstagedChanges();

    CompletableFuture<List<ChangedFile>> getStagedChanges();

    CompletableFuture<List<ChangedFile>> getStagedChangesSinceParentCommit();

    /** @return the patch, or empty when the two versions are the same */
    CompletableFuture<Optional<FilePatch>> getFilePatchForPath(String path, FilePatchOptions options);

    CompletableFuture<Boolean> isPartiallyStaged(String path);

    CompletableFuture<Optional<String>> readFileFromIndex(String path);

    // ---- history ----

    CompletableFuture<Void> commit(String message, CommitOptions options);

    CompletableFuture<Void> merge(String ref);

    CompletableFuture<Void> abortMerge();

    /** Switches to a branch, or detaches HEAD at any other revision. */
    CompletableFuture<Void> checkout(String revision);

    CompletableFuture<List<MergeConflict>> getMergeConflicts();

    CompletableFuture<Boolean> pathHasMergeMarkers(String path);

    CompletableFuture<CommitInfo> getLastCommit();

    CompletableFuture<CommitInfo> getCommit(String ref);

    // ---- branches and remotes ----

    CompletableFuture<List<Branch>> getBranches();

    CompletableFuture<String> getCurrentBranch();

    CompletableFuture<List<Remote>> getRemotes();

    CompletableFuture<Void> fetch(String branch);

    CompletableFuture<Void> pull(String branch);

    /** Pushes {@code branch}, setting up tracking when the branch has no remote configured yet. */
    CompletableFuture<Void> push(String branch);

    CompletableFuture<Integer> getAheadCount(String branch);

    CompletableFuture<Integer> getBehindCount(String branch);

    CompletableFuture<Optional<Remote>> getRemoteForBranch(String branch);

    // ---- discard history ----

    CompletableFuture<Void> discardWorkDirChangesForPaths(Collection<String> paths);

    <E extends Exception> CompletableFuture<List<DiscardSnapshot>> storeBeforeAndAfterBlobs(
            Collection<String> paths,
            Predicate<String> isSafe,
            DiscardHistoryStore.Mutation<E> mutate,
            @Nullable String groupKey);

    CompletableFuture<String> createDiscardHistoryBlob();

    CompletableFuture<Void> updateDiscardHistory();

    CompletableFuture<List<List<DiscardSnapshot>>> getDiscardHistory(@Nullable String groupKey);

    CompletableFuture<Boolean> hasDiscardHistory(@Nullable String groupKey);

    CompletableFuture<List<DiscardSnapshot>> getLastHistorySnapshots(@Nullable String groupKey);

    CompletableFuture<Void> popDiscardHistory(@Nullable String groupKey);

    CompletableFuture<Void> clearDiscardHistory(@Nullable String groupKey);

    /** @return paths that changed since the discard and were left alone */
    CompletableFuture<List<String>> undoLastDiscard(@Nullable String groupKey);

    // ---- config ----

    CompletableFuture<Optional<String>> getConfig(String key, boolean local);

    CompletableFuture<Void> setConfig(String key, String value);

    CompletableFuture<Void> unsetConfig(String key);
}
