package io.github.jbellis.gitstate.git;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.dircache.DirCache;
import org.eclipse.jgit.dircache.DirCacheEntry;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.FileMode;
import org.eclipse.jgit.lib.IndexDiff;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectInserter;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.treewalk.FileTreeIterator;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.jetbrains.annotations.Nullable;

/**
 * Helper class extracted from GitRepo to encapsulate status, content, index and object-store operations.
 *
 * <p>Index writes go through a locked {@link DirCache} and leave the new entries without a timestamp, so the next
 * status call compares content instead of trusting stat data.
 */
public class GitRepoData {
    private static final Logger logger = LogManager.getLogger(GitRepoData.class);

    private final GitRepo repo;
    private final Repository repository;
    private final Git git;

    GitRepoData(GitRepo repo) {
        this.repo = repo;
        this.repository = repo.getRepository();
        this.git = repo.getGit();
    }

    public WorkingTreeStatus getStatus() throws GitAPIException {
        var status = git.status().call();
        Set<String> conflicted = status.getConflicting();

        var staged = new HashMap<String, GitStatus>();
        put(staged, status.getAdded(), GitStatus.ADDED, conflicted);
        put(staged, status.getChanged(), GitStatus.MODIFIED, conflicted);
        put(staged, status.getRemoved(), GitStatus.DELETED, conflicted);

        var unstaged = new HashMap<String, GitStatus>();
        put(unstaged, status.getModified(), GitStatus.MODIFIED, conflicted);
        put(unstaged, status.getMissing(), GitStatus.DELETED, conflicted);
        put(unstaged, status.getUntracked(), GitStatus.ADDED, conflicted);

        return WorkingTreeStatus.of(staged, unstaged, conflicted);
    }

    private static void put(Map<String, GitStatus> target, Set<String> paths, GitStatus status, Set<String> skip) {
        for (var path : paths) {
            if (!skip.contains(path)) {
                target.put(path, status);
            }
        }
    }

    public List<ChangedFile> getStagedStatusesAgainst(String rev) throws GitAPIException {
        try {
            ObjectId treeId = repository.resolve(rev + "^{tree}");
            if (treeId == null) {
                logger.debug("{} does not resolve; comparing the index against the empty tree", rev);
            }
            var diff = new IndexDiff(repository, treeId, new FileTreeIterator(repository));
            diff.diff();
            var conflicted = diff.getConflicting();

            var result = new LinkedHashMap<String, GitStatus>();
            put(result, diff.getAdded(), GitStatus.ADDED, conflicted);
            put(result, diff.getChanged(), GitStatus.MODIFIED, conflicted);
            put(result, diff.getRemoved(), GitStatus.DELETED, conflicted);
            return result.entrySet().stream()
                    .map(e -> new ChangedFile(e.getKey(), e.getValue()))
                    .sorted(Comparator.comparing(ChangedFile::filePath))
                    .toList();
        } catch (IOException e) {
            throw new GitRepo.GitWrappedIOException("git diff --cached --name-status " + rev, e);
        }
    }

    public Optional<byte[]> readIndexContent(String path) throws GitAPIException {
        try {
            var entry = findReadableEntry(repository.readDirCache(), path);
            if (entry == null) {
                return Optional.empty();
            }
            return Optional.of(repository.open(entry.getObjectId(), Constants.OBJ_BLOB).getBytes());
        } catch (IOException e) {
            throw new GitRepo.GitWrappedIOException("git show :" + path, e);
        }
    }

    /** Stage 0 if present, otherwise the "ours" stage of a conflicted path. */
    private static @Nullable DirCacheEntry findReadableEntry(DirCache dc, String path) {
        int idx = dc.findEntry(path);
        if (idx < 0) {
            return null;
        }
        DirCacheEntry ours = null;
        for (int i = idx; i < dc.getEntryCount(); i++) {
            var entry = dc.getEntry(i);
            if (!entry.getPathString().equals(path)) {
                break;
            }
            if (entry.getStage() == DirCacheEntry.STAGE_0) {
                return entry;
            }
            if (entry.getStage() == DirCacheEntry.STAGE_2) {
                ours = entry;
            }
        }
        return ours;
    }

    boolean isInIndex(String path) throws GitAPIException {
        try {
            return repository.readDirCache().findEntry(path) >= 0;
        } catch (IOException e) {
            throw new GitRepo.GitWrappedIOException("git ls-files -- " + path, e);
        }
    }

    public Optional<byte[]> readCommitContent(String rev, String path) throws GitAPIException {
        try {
            var treeId = repository.resolve(rev + "^{tree}");
            if (treeId == null) {
                return Optional.empty();
            }
            try (var tw = TreeWalk.forPath(repository, path, treeId)) {
                if (tw == null || tw.getFileMode(0).getObjectType() != Constants.OBJ_BLOB) {
                    return Optional.empty();
                }
                return Optional.of(repository.open(tw.getObjectId(0), Constants.OBJ_BLOB).getBytes());
            }
        } catch (IOException e) {
            throw new GitRepo.GitWrappedIOException("git show " + rev + ":" + path, e);
        }
    }

    public Optional<byte[]> readWorkingTreeContent(String path) throws GitAPIException {
        var file = resolveInWorkTree(path);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new GitRepo.GitWrappedIOException("cat " + path, e);
        }
    }

    public void writeWorkingTreeFile(String path, byte @Nullable [] content) throws GitAPIException {
        var file = resolveInWorkTree(path);
        try {
            if (content == null) {
                Files.deleteIfExists(file);
            } else {
                var parent = file.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.write(file, content);
            }
        } catch (IOException e) {
            throw new GitRepo.GitWrappedIOException((content == null ? "rm " : "write ") + path, e);
        }
    }

    private Path resolveInWorkTree(String path) {
        var root = repo.getWorkTree().toAbsolutePath().normalize();
        var file = root.resolve(path).normalize();
        if (!file.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes the working tree: " + path);
        }
        return file;
    }

    public List<UnmergedPath> getUnmergedPaths() throws GitAPIException {
        DirCache dc;
        try {
            dc = repository.readDirCache();
        } catch (IOException e) {
            throw new GitRepo.GitWrappedIOException("git ls-files --unmerged", e);
        }

        var stages = new LinkedHashMap<String, String[]>();
        for (int i = 0; i < dc.getEntryCount(); i++) {
            var entry = dc.getEntry(i);
            int stage = entry.getStage();
            if (stage == DirCacheEntry.STAGE_0) {
                continue;
            }
            stages.computeIfAbsent(entry.getPathString(), p -> new String[3])[stage - 1] =
                    entry.getObjectId().getName();
        }
        return stages.entrySet().stream()
                .map(e -> new UnmergedPath(e.getKey(), e.getValue()[0], e.getValue()[1], e.getValue()[2]))
                .sorted(Comparator.comparing(UnmergedPath::path))
                .toList();
    }

    public void writeIndexEntry(String path, byte @Nullable [] content) throws GitAPIException {
        var commandLine = "git update-index " + (content == null ? "--remove " : "--add ") + path;
        try {
            ObjectId id = null;
            if (content != null) {
                try (var inserter = repository.newObjectInserter()) {
                    id = inserter.insert(Constants.OBJ_BLOB, content);
                    inserter.flush();
                }
            }
            var replacements = new HashMap<String, IndexReplacement>();
            replacements.put(path, id == null ? null : new IndexReplacement(id, content.length, null));
            rewriteIndex(replacements);
        } catch (IOException e) {
            throw new GitRepo.GitWrappedIOException(commandLine, e);
        }
    }

    /**
     * Replaces every entry of {@code path} with the given conflict stages: 1 for the common base, 2 for ours, 3 for
     * theirs. A null id leaves that stage out.
     */
    public synchronized void writeMergeConflictToIndex(
            String path, @Nullable String baseId, @Nullable String oursId, @Nullable String theirsId)
            throws GitAPIException {
        var commandLine = "git update-index --index-info " + path;
        var ids = new String[] {baseId, oursId, theirsId};
        try {
            var dc = repository.lockDirCache();
            try {
                var builder = dc.builder();
                var mode = FileMode.REGULAR_FILE;
                for (int i = 0; i < dc.getEntryCount(); i++) {
                    var entry = dc.getEntry(i);
                    if (entry.getPathString().equals(path)) {
                        mode = entry.getFileMode();
                    } else {
                        builder.add(entry);
                    }
                }
                for (int i = 0; i < ids.length; i++) {
                    if (ids[i] == null) {
                        continue;
                    }
                    if (!ObjectId.isId(ids[i])) {
                        throw new CommandFailure(commandLine, 128, "fatal: invalid object id " + ids[i]);
                    }
                    var id = ObjectId.fromString(ids[i]);
                    var entry = new DirCacheEntry(path, i + 1);
                    entry.setFileMode(mode);
                    entry.setObjectId(id);
                    entry.setLength(repository.open(id, Constants.OBJ_BLOB).getSize());
                    builder.add(entry);
                }
                builder.commit();
            } finally {
                dc.unlock();
            }
            logger.debug("Wrote conflict stages for {}", path);
        } catch (org.eclipse.jgit.errors.MissingObjectException e) {
            throw new CommandFailure(commandLine, 128, "fatal: Not a valid object name " + e.getObjectId().name(), e);
        } catch (IOException e) {
            throw new GitRepo.GitWrappedIOException(commandLine, e);
        }
    }

    /** Makes the index entries for {@code paths} match {@code rev}; an unresolvable rev means the empty tree. */
    void resetIndexPaths(String rev, Collection<String> paths, String commandLine) throws GitAPIException {
        if (paths.isEmpty()) {
            return;
        }
        try {
            var treeId = repository.resolve(rev + "^{tree}");
            var replacements = new HashMap<String, IndexReplacement>();
            for (var path : paths) {
                IndexReplacement replacement = null;
                if (treeId != null) {
                    try (var tw = TreeWalk.forPath(repository, path, treeId)) {
                        if (tw != null && tw.getFileMode(0).getObjectType() == Constants.OBJ_BLOB) {
                            var id = tw.getObjectId(0);
                            var size = repository.open(id, Constants.OBJ_BLOB).getSize();
                            replacement = new IndexReplacement(id, size, tw.getFileMode(0));
                        }
                    }
                }
                replacements.put(path, replacement);
            }
            rewriteIndex(replacements);
            logger.debug("Reset {} index entries to {}", paths.size(), rev);
        } catch (IOException e) {
            throw new GitRepo.GitWrappedIOException(commandLine, e);
        }
    }

    private record IndexReplacement(ObjectId id, long length, @Nullable FileMode mode) {}

    /**
     * Rebuilds the index with every stage of each key path dropped and, for non-null values, one stage 0 entry
     * added in its place.
     */
    private synchronized void rewriteIndex(Map<String, @Nullable IndexReplacement> replacements) throws IOException {
        var dc = repository.lockDirCache();
        try {
            var builder = dc.builder();
            var existingModes = new HashMap<String, FileMode>();
            for (int i = 0; i < dc.getEntryCount(); i++) {
                var entry = dc.getEntry(i);
                if (replacements.containsKey(entry.getPathString())) {
                    existingModes.putIfAbsent(entry.getPathString(), entry.getFileMode());
                } else {
                    builder.add(entry);
                }
            }
            var added = new HashSet<String>();
            for (var e : replacements.entrySet()) {
                var replacement = e.getValue();
                if (replacement == null || !added.add(e.getKey())) {
                    continue;
                }
                var mode = replacement.mode() != null
                        ? replacement.mode()
                        : existingModes.getOrDefault(e.getKey(), FileMode.REGULAR_FILE);
                var entry = new DirCacheEntry(e.getKey());
                entry.setFileMode(mode);
                entry.setObjectId(replacement.id());
                entry.setLength(replacement.length());
                builder.add(entry);
            }
            builder.commit();
        } finally {
            dc.unlock();
        }
    }

    public String hashObject(byte[] content) {
        return new ObjectInserter.Formatter().idFor(Constants.OBJ_BLOB, content).getName();
    }

    public String writeObject(byte[] content) throws GitAPIException {
        try (var inserter = repository.newObjectInserter()) {
            var id = inserter.insert(Constants.OBJ_BLOB, content);
            inserter.flush();
            return id.getName();
        } catch (IOException e) {
            throw new GitRepo.GitWrappedIOException("git hash-object -w --stdin", e);
        }
    }

    public byte[] readObject(String id) throws GitAPIException {
        var commandLine = "git cat-file blob " + id;
        if (!ObjectId.isId(id)) {
            throw new CommandFailure(commandLine, 128, "fatal: Not a valid object name " + id);
        }
        try {
            return repository.open(ObjectId.fromString(id), Constants.OBJ_BLOB).getBytes();
        } catch (org.eclipse.jgit.errors.MissingObjectException e) {
            throw new CommandFailure(commandLine, 128, "fatal: Not a valid object name " + id, e);
        } catch (IOException e) {
            throw new GitRepo.GitWrappedIOException(commandLine, e);
        }
    }
}
