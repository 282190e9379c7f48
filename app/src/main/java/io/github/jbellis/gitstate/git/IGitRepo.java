package io.github.jbellis.gitstate.git;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.jetbrains.annotations.Nullable;

/**
 * Version-control plumbing consumed by the repository facade. Paths are repository-relative with forward slashes.
 * Every method is a synchronous call; the facade decides what runs where.
 */
public interface IGitRepo extends AutoCloseable {

    Path getWorkTree();

    /** Runs the git executable in the work tree. A non-zero exit is reported in the result, not thrown. */
    ExecResult exec(List<String> args) throws GitAPIException;

    // ---- status and diff inputs ----

    WorkingTreeStatus getStatus() throws GitAPIException;

    /** Index entries that differ from {@code rev}; an unresolvable rev compares against the empty tree. */
    List<ChangedFile> getStagedStatusesAgainst(String rev) throws GitAPIException;

    /** Stage 0 content, or the "ours" stage for an unmerged path. */
    Optional<byte[]> readIndexContent(String path) throws GitAPIException;

    /** Content of {@code path} at {@code rev}; empty when the rev or the path does not exist. */
    Optional<byte[]> readCommitContent(String rev, String path) throws GitAPIException;

    Optional<byte[]> readWorkingTreeContent(String path) throws GitAPIException;

    List<UnmergedPath> getUnmergedPaths() throws GitAPIException;

    // ---- index and working tree mutation ----

    /** Replaces every stage of {@code path} with one stage 0 entry holding {@code content}, or removes it. */
    void writeIndexEntry(String path, byte @Nullable [] content) throws GitAPIException;

    /** Writes or deletes a working tree file. */
    void writeWorkingTreeFile(String path, byte @Nullable [] content) throws GitAPIException;

    /** Adds present files and removes missing ones from the index. */
    void stage(Collection<String> paths) throws GitAPIException;

    /** Resets index entries for {@code paths} to HEAD. */
    void unstage(Collection<String> paths) throws GitAPIException;

    /** Resets index entries for {@code paths} to their content at {@code rev}. */
    void stageFromCommit(String rev, Collection<String> paths) throws GitAPIException;

    /** Resolves conflicted paths by checking out one side and staging it. */
    void checkoutSide(ConflictSide side, Collection<String> paths) throws GitAPIException;

    /** Restores working tree files from the index; untracked files are deleted. */
    void restoreFromIndex(Collection<String> paths) throws GitAPIException;

    /** Replaces the entries of {@code path} with conflict stages; a null id leaves that stage out. */
    void writeMergeConflictToIndex(
            String path, @Nullable String baseId, @Nullable String oursId, @Nullable String theirsId)
            throws GitAPIException;

    /** Switches to a branch, or detaches HEAD at any other revision. */
    void checkout(String revision) throws GitAPIException;

    /** Sets the index entries and working tree files of {@code paths} to their content at {@code revision}. */
    void checkoutPathsAtRevision(Collection<String> paths, String revision) throws GitAPIException;

    // ---- objects and config ----

    String hashObject(byte[] content) throws GitAPIException;

    String writeObject(byte[] content) throws GitAPIException;

    /** @throws CommandFailure when the id is malformed or names no blob */
    byte[] readObject(String id) throws GitAPIException;

    Optional<String> getConfig(String key, boolean local) throws GitAPIException;

    void setConfig(String key, String value) throws GitAPIException;

    void unsetConfig(String key) throws GitAPIException;

    // ---- history and refs ----

    CommitInfo getCommit(String ref) throws GitAPIException;

    /** HEAD, or the unborn commit in a repository without commits. */
    CommitInfo getHeadCommit() throws GitAPIException;

    void commit(String message, boolean amend, boolean allowEmpty) throws GitAPIException;

    /** Merges {@code ref} into HEAD; a conflicted merge fails with {@link CommandFailure} and leaves the markers. */
    void merge(String ref) throws GitAPIException;

    void abortMerge() throws GitAPIException;

    boolean isMerging() throws GitAPIException;

    List<Branch> listBranches() throws GitAPIException;

    String getCurrentBranch() throws GitAPIException;

    List<Remote> listRemotes() throws GitAPIException;

    // ---- remotes ----

    void fetch(String branch) throws GitAPIException;

    void pull(String branch) throws GitAPIException;

    void push(String branch, boolean setUpstream) throws GitAPIException;

    int getAheadCount(String branch) throws GitAPIException;

    int getBehindCount(String branch) throws GitAPIException;

    @Override
    void close();
}
