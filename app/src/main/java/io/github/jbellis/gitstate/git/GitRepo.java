package io.github.jbellis.gitstate.git;

import io.github.jbellis.gitstate.conflict.MergeMarkers;
import io.github.jbellis.gitstate.util.GitStateSettings;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.CheckoutCommand;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.MergeResult;
import org.eclipse.jgit.api.ResetCommand;
import org.eclipse.jgit.api.errors.CheckoutConflictException;
import org.eclipse.jgit.api.errors.EmptyCommitException;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.UnmergedPathsException;
import org.eclipse.jgit.errors.ConfigInvalidException;
import org.eclipse.jgit.errors.IncorrectObjectTypeException;
import org.eclipse.jgit.lib.BranchConfig;
import org.eclipse.jgit.lib.CommitConfig;
import org.eclipse.jgit.lib.Config;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.lib.RepositoryState;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.storage.file.FileBasedConfig;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.util.FS;
import org.jetbrains.annotations.Nullable;

/**
 * A git repository abstraction using JGit, rooted at a working tree that holds its own {@code .git} directory.
 *
 * <p>Status, content and index primitives live in {@link GitRepoData}; fetch, pull and push in {@link GitRepoRemote}.
 * Failures surface as {@link CommandFailure} carrying the git command line the call corresponds to.
 */
public class GitRepo implements IGitRepo {
    private static final Logger logger = LogManager.getLogger(GitRepo.class);

    private final Path workTree;
    private final Repository repository;
    private final Git git;
    private final GitStateSettings settings;

    private final GitRepoData data;
    private final GitRepoRemote remote;

    public GitRepo(Path workTree) {
        this(workTree, GitStateSettings.load());
    }

    public GitRepo(Path workTree, GitStateSettings settings) {
        this.workTree = workTree;
        this.settings = settings;
        try {
            repository = new FileRepositoryBuilder()
                    .setWorkTree(workTree.toFile())
                    .setGitDir(workTree.resolve(".git").toFile())
                    .setMustExist(true)
                    .build();
        } catch (IOException e) {
            throw new IllegalArgumentException("No git repo found at " + workTree, e);
        }
        git = new Git(repository);
        data = new GitRepoData(this);
        remote = new GitRepoRemote(this);
    }

    public GitRepoData data() {
        return data;
    }

    public GitRepoRemote remote() {
        return remote;
    }

    /** Get the JGit instance for direct API access */
    public Git getGit() {
        return git;
    }

    Repository getRepository() {
        return repository;
    }

    GitStateSettings getSettings() {
        return settings;
    }

    @Override
    public Path getWorkTree() {
        return workTree;
    }

    @Override
    public ExecResult exec(List<String> args) throws GitAPIException {
        var command = new ArrayList<String>();
        command.add(settings.gitExecutable());
        command.addAll(args);
        var commandLine = String.join(" ", command);
        logger.debug("Running {} in {}", commandLine, workTree);

        try {
            var process = new ProcessBuilder(command).directory(workTree.toFile()).start();
            process.getOutputStream().close();
            var stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));
            var stdout = readFully(process.getInputStream());
            int exitCode = process.waitFor();
            return new ExecResult(exitCode, stdout, stderr.join());
        } catch (IOException e) {
            throw new GitWrappedIOException(commandLine, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CommandFailure(commandLine, 130, "interrupted", e);
        }
    }

    private static String readFully(InputStream in) {
        try (in) {
            var out = new ByteArrayOutputStream();
            in.transferTo(out);
            return out.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.debug("Error reading process output: {}", e.getMessage());
            return "";
        }
    }

    // ---- status, content and index: see GitRepoData ----

    @Override
    public WorkingTreeStatus getStatus() throws GitAPIException {
        return data.getStatus();
    }

    @Override
    public List<ChangedFile> getStagedStatusesAgainst(String rev) throws GitAPIException {
        return data.getStagedStatusesAgainst(rev);
    }

    @Override
    public Optional<byte[]> readIndexContent(String path) throws GitAPIException {
        return data.readIndexContent(path);
    }

    @Override
    public Optional<byte[]> readCommitContent(String rev, String path) throws GitAPIException {
        return data.readCommitContent(rev, path);
    }

    @Override
    public Optional<byte[]> readWorkingTreeContent(String path) throws GitAPIException {
        return data.readWorkingTreeContent(path);
    }

    @Override
    public List<UnmergedPath> getUnmergedPaths() throws GitAPIException {
        return data.getUnmergedPaths();
    }

    @Override
    public void writeIndexEntry(String path, byte @Nullable [] content) throws GitAPIException {
        data.writeIndexEntry(path, content);
    }

    @Override
    public void writeWorkingTreeFile(String path, byte @Nullable [] content) throws GitAPIException {
        data.writeWorkingTreeFile(path, content);
    }

    @Override
    public synchronized void stage(Collection<String> paths) throws GitAPIException {
        if (paths.isEmpty()) {
            return;
        }
        var present = new ArrayList<String>();
        var missing = new ArrayList<String>();
        for (var path : paths) {
            (Files.exists(workTree.resolve(path)) ? present : missing).add(path);
        }
        logger.debug("Staging {} present and {} missing paths", present.size(), missing.size());
        try {
            if (!present.isEmpty()) {
                var add = git.add();
                present.forEach(add::addFilepattern);
                add.call();
            }
            if (!missing.isEmpty()) {
                var rm = git.rm().setCached(true);
                missing.forEach(rm::addFilepattern);
                rm.call();
            }
        } catch (GitAPIException e) {
            throw asFailure("git add -- " + String.join(" ", paths), e);
        }
    }

    @Override
    public void unstage(Collection<String> paths) throws GitAPIException {
        data.resetIndexPaths("HEAD", paths, "git reset HEAD -- " + String.join(" ", paths));
    }

    @Override
    public void stageFromCommit(String rev, Collection<String> paths) throws GitAPIException {
        data.resetIndexPaths(rev, paths, "git reset " + rev + " -- " + String.join(" ", paths));
    }

    /**
     * Checkout conflicted paths from a specific stage (ours/theirs) and stage them to resolve the conflict.
     */
    @Override
    public synchronized void checkoutSide(ConflictSide side, Collection<String> paths) throws GitAPIException {
        if (paths.isEmpty()) {
            return;
        }
        var stage =
                switch (side) {
                    case OURS -> CheckoutCommand.Stage.OURS;
                    case THEIRS -> CheckoutCommand.Stage.THEIRS;
                };
        var commandLine = "git checkout --" + side.name().toLowerCase() + " -- " + String.join(" ", paths);
        try {
            git.checkout().addPaths(List.copyOf(paths)).setStage(stage).call();
            var add = git.add();
            paths.forEach(add::addFilepattern);
            add.call();
        } catch (GitAPIException e) {
            throw asFailure(commandLine, e);
        }
    }

    @Override
    public synchronized void restoreFromIndex(Collection<String> paths) throws GitAPIException {
        var tracked = new ArrayList<String>();
        for (var path : paths) {
            if (data.isInIndex(path)) {
                tracked.add(path);
            } else {
                data.writeWorkingTreeFile(path, null);
            }
        }
        if (tracked.isEmpty()) {
            return;
        }
        try {
            git.checkout().addPaths(tracked).call();
        } catch (GitAPIException e) {
            throw asFailure("git checkout -- " + String.join(" ", tracked), e);
        }
    }

    @Override
    public void writeMergeConflictToIndex(
            String path, @Nullable String baseId, @Nullable String oursId, @Nullable String theirsId)
            throws GitAPIException {
        data.writeMergeConflictToIndex(path, baseId, oursId, theirsId);
    }

    @Override
    public synchronized void checkout(String revision) throws GitAPIException {
        var commandLine = "git checkout " + revision;
        try {
            resolveToCommit(revision);
        } catch (GitRepoException | GitStateException e) {
            throw new CommandFailure(
                    commandLine,
                    1,
                    "error: pathspec '" + revision + "' did not match any file(s) known to git",
                    e);
        }
        try {
            git.checkout().setName(revision).call();
        } catch (CheckoutConflictException e) {
            throw new CommandFailure(
                    commandLine,
                    1,
                    "error: Your local changes to the following files would be overwritten by checkout:\n\t"
                            + String.join("\n\t", e.getConflictingPaths()),
                    e);
        } catch (GitAPIException e) {
            throw asFailure(commandLine, e);
        }
        logger.debug("Checked out {}", revision);
    }

    @Override
    public synchronized void checkoutPathsAtRevision(Collection<String> paths, String revision)
            throws GitAPIException {
        if (paths.isEmpty()) {
            return;
        }
        var commandLine = "git checkout " + revision + " -- " + String.join(" ", paths);
        try {
            resolveToCommit(revision);
        } catch (GitRepoException | GitStateException e) {
            throw new CommandFailure(commandLine, 128, "fatal: invalid reference: " + revision, e);
        }
        for (var path : paths) {
            if (readCommitContent(revision, path).isEmpty()) {
                throw new CommandFailure(
                        commandLine, 1, "error: pathspec '" + path + "' did not match any file(s) known to git");
            }
        }
        try {
            git.checkout().setStartPoint(revision).addPaths(List.copyOf(paths)).call();
        } catch (GitAPIException e) {
            throw asFailure(commandLine, e);
        }
    }

    // ---- objects ----

    @Override
    public String hashObject(byte[] content) {
        return data.hashObject(content);
    }

    @Override
    public String writeObject(byte[] content) throws GitAPIException {
        return data.writeObject(content);
    }

    @Override
    public byte[] readObject(String id) throws GitAPIException {
        return data.readObject(id);
    }

    // ---- config ----

    private record ConfigKey(String section, @Nullable String subsection, String name) {
        static ConfigKey parse(String key) throws CommandFailure {
            int first = key.indexOf('.');
            int last = key.lastIndexOf('.');
            if (first <= 0 || last == key.length() - 1) {
                throw new CommandFailure("git config " + key, 1, "error: key does not contain a section: " + key);
            }
            var subsection = first == last ? null : key.substring(first + 1, last);
            return new ConfigKey(key.substring(0, first), subsection, key.substring(last + 1));
        }
    }

    @Override
    public Optional<String> getConfig(String key, boolean local) throws GitAPIException {
        var parsed = ConfigKey.parse(key);
        Config config;
        if (local) {
            var localConfig = new FileBasedConfig(new File(repository.getDirectory(), "config"), FS.DETECTED);
            try {
                localConfig.load();
            } catch (IOException e) {
                throw new GitWrappedIOException("git config --local " + key, e);
            } catch (ConfigInvalidException e) {
                throw new CommandFailure("git config --local " + key, 3, "fatal: bad config file", e);
            }
            config = localConfig;
        } else {
            config = repository.getConfig();
        }
        return Optional.ofNullable(config.getString(parsed.section(), parsed.subsection(), parsed.name()));
    }

    @Override
    public synchronized void setConfig(String key, String value) throws GitAPIException {
        var parsed = ConfigKey.parse(key);
        var config = repository.getConfig();
        config.setString(parsed.section(), parsed.subsection(), parsed.name(), value);
        try {
            config.save();
        } catch (IOException e) {
            throw new GitWrappedIOException("git config " + key + " " + value, e);
        }
    }

    @Override
    public synchronized void unsetConfig(String key) throws GitAPIException {
        var parsed = ConfigKey.parse(key);
        var config = repository.getConfig();
        config.unset(parsed.section(), parsed.subsection(), parsed.name());
        try {
            config.save();
        } catch (IOException e) {
            throw new GitWrappedIOException("git config --unset " + key, e);
        }
    }

    // ---- history and refs ----

    public ObjectId resolveToObject(String revstr) throws GitAPIException {
        try {
            var id = repository.resolve(revstr);
            if (id == null) {
                throw new GitRepoException("Unable to resolve " + revstr, new NoSuchElementException());
            }
            return id;
        } catch (IOException e) {
            throw new GitWrappedIOException("git rev-parse " + revstr, e);
        }
    }

    public ObjectId resolveToCommit(String revstr) throws GitAPIException {
        // Prefer JGit rev-spec peeling first
        try {
            var commitId = repository.resolve(revstr.endsWith("^{commit}") ? revstr : (revstr + "^{commit}"));
            if (commitId != null) {
                return commitId;
            }
        } catch (IOException e) {
            throw new GitWrappedIOException("git rev-parse " + revstr, e);
        }

        // Fallback: resolve to any object and try to peel with RevWalk
        var anyId = resolveToObject(revstr);
        try (var rw = new RevWalk(repository)) {
            try {
                return rw.parseCommit(anyId).getId();
            } catch (IncorrectObjectTypeException e) {
                var peeled = rw.peel(rw.parseAny(anyId));
                if (peeled instanceof RevCommit rc) {
                    return rc.getId();
                }
                throw new GitStateException("Reference does not resolve to a commit: " + revstr);
            }
        } catch (IOException e) {
            throw new GitWrappedIOException("git rev-parse " + revstr, e);
        }
    }

    @Override
    public CommitInfo getCommit(String ref) throws GitAPIException {
        ObjectId id;
        try {
            id = resolveToCommit(ref);
        } catch (GitRepoException | GitStateException e) {
            throw new CommandFailure(
                    "git log -1 " + ref, 128, "fatal: ambiguous argument '" + ref + "': unknown revision", e);
        }
        try (var rw = new RevWalk(repository)) {
            return CommitInfo.fromRevCommit(rw.parseCommit(id));
        } catch (IOException e) {
            throw new GitWrappedIOException("git log -1 " + ref, e);
        }
    }

    @Override
    public CommitInfo getHeadCommit() throws GitAPIException {
        try {
            if (repository.resolve("HEAD^{commit}") == null) {
                return CommitInfo.unborn();
            }
        } catch (IOException e) {
            throw new GitWrappedIOException("git log -1 HEAD", e);
        }
        return getCommit("HEAD");
    }

    @Override
    public synchronized void commit(String message, boolean amend, boolean allowEmpty) throws GitAPIException {
        var commandLine = "git commit" + (amend ? " --amend" : "") + (allowEmpty ? " --allow-empty" : "")
                + " --cleanup=verbatim -m " + message;
        try {
            var result = git.commit()
                    .setMessage(message)
                    .setAmend(amend)
                    .setAllowEmpty(allowEmpty)
                    .setCleanupMode(CommitConfig.CleanupMode.VERBATIM)
                    .setSign(false)
                    .call();
            logger.debug("Committed {}{}", result.getName(), amend ? " (amend)" : "");
        } catch (UnmergedPathsException e) {
            throw new CommandFailure(
                    commandLine,
                    128,
                    "error: Committing is not possible because you have unmerged files.\n"
                            + "fatal: Exiting because of an unresolved conflict.",
                    e);
        } catch (EmptyCommitException e) {
            throw new CommandFailure(commandLine, 1, "nothing to commit, working tree clean", e);
        } catch (GitAPIException e) {
            throw asFailure(commandLine, e);
        }
    }

    @Override
    public synchronized void merge(String ref) throws GitAPIException {
        var commandLine = "git merge " + ref;
        ObjectId id;
        try {
            id = resolveToCommit(ref);
        } catch (GitRepoException | GitStateException e) {
            throw new CommandFailure(commandLine, 1, "merge: " + ref + " - not something we can merge", e);
        }

        MergeResult result;
        try {
            result = git.merge().include(ref, id).setCommit(true).call();
        } catch (GitAPIException e) {
            throw asFailure(commandLine, e);
        }
        logger.debug("Merge of {} finished with {}", ref, result.getMergeStatus());
        if (result.getMergeStatus().isSuccessful()) {
            return;
        }

        var conflicts = getUnmergedPaths().stream()
                .map(u -> "CONFLICT (content): Merge conflict in " + u.path())
                .collect(Collectors.joining("\n"));
        if (!conflicts.isEmpty()) {
            throw new CommandFailure(
                    commandLine, 1, conflicts + "\nAutomatic merge failed; fix conflicts and then commit the result.");
        }
        var failing = result.getFailingPaths() == null
                ? ""
                : String.join("\n\t", result.getFailingPaths().keySet());
        throw new CommandFailure(
                commandLine,
                2,
                "error: Your local changes to the following files would be overwritten by merge:\n\t" + failing);
    }

    /**
     * Aborts an in-progress merge: the index and every path the merge touched go back to HEAD, changes the merge did
     * not touch stay as they are. Refuses when a conflicted file was edited into something that is neither a merge
     * result with markers nor one of its stages, since that work would be lost.
     */
    @Override
    public synchronized void abortMerge() throws GitAPIException {
        var commandLine = "git merge --abort";
        if (!isMerging()) {
            throw new CommandFailure(commandLine, 128, "fatal: There is no merge to abort (MERGE_HEAD missing).");
        }

        var unmerged = getUnmergedPaths();
        for (var path : unmerged) {
            var content = readWorkingTreeContent(path.path());
            if (content.isEmpty()) {
                continue;
            }
            var text = new String(content.get(), StandardCharsets.UTF_8);
            if (MergeMarkers.hasMarkers(text)) {
                continue;
            }
            var id = hashObject(content.get());
            if (!id.equals(path.baseId()) && !id.equals(path.oursId()) && !id.equals(path.theirsId())) {
                throw new CommandFailure(
                        commandLine, 128, "error: Entry '" + path.path() + "' not uptodate. Cannot merge.");
            }
        }

        var touched = new TreeSet<String>();
        getStagedStatusesAgainst("HEAD").forEach(c -> touched.add(c.filePath()));
        unmerged.forEach(u -> touched.add(u.path()));

        try {
            git.reset().setMode(ResetCommand.ResetType.MIXED).setRef("HEAD").call();
            var inHead = new ArrayList<String>();
            for (var path : touched) {
                if (readCommitContent("HEAD", path).isPresent()) {
                    inHead.add(path);
                } else {
                    writeWorkingTreeFile(path, null);
                }
            }
            if (!inHead.isEmpty()) {
                git.checkout().setStartPoint("HEAD").addPaths(inHead).call();
            }
            repository.writeMergeHeads(null);
            repository.writeMergeCommitMsg(null);
        } catch (IOException e) {
            throw new GitWrappedIOException(commandLine, e);
        } catch (GitAPIException e) {
            throw asFailure(commandLine, e);
        }
        logger.debug("Aborted merge; restored {} paths", touched.size());
    }

    @Override
    public boolean isMerging() {
        var state = repository.getRepositoryState();
        return state == RepositoryState.MERGING || state == RepositoryState.MERGING_RESOLVED;
    }

    @Override
    public List<Branch> listBranches() throws GitAPIException {
        var result = new ArrayList<Branch>();
        for (var ref : git.branchList().call()) {
            var name = Repository.shortenRefName(ref.getName());
            var objectId = ref.getObjectId();
            var upstream = new BranchConfig(repository.getConfig(), name).getTrackingBranch();
            result.add(new Branch(name, objectId == null ? null : objectId.getName(), upstream));
        }
        result.sort(Comparator.comparing(Branch::name));
        return result;
    }

    /** Get current branch name, or the abbreviated commit id when HEAD is detached */
    @Override
    public String getCurrentBranch() throws GitAPIException {
        try {
            var full = repository.getFullBranch();
            if (full == null) {
                throw new GitRepoException("Repository has no HEAD", new NullPointerException());
            }
            if (full.startsWith("refs/heads/")) {
                return Repository.shortenRefName(full);
            }
            var head = ObjectId.fromString(full);
            try (var reader = repository.newObjectReader()) {
                return reader.abbreviate(head).name();
            }
        } catch (IOException e) {
            throw new GitWrappedIOException("git rev-parse --abbrev-ref HEAD", e);
        }
    }

    @Override
    public List<Remote> listRemotes() throws GitAPIException {
        return git.remoteList().call().stream()
                .map(rc -> new Remote(
                        rc.getName(), rc.getURIs().isEmpty() ? "" : rc.getURIs().get(0).toString()))
                .sorted(Comparator.comparing(Remote::name))
                .toList();
    }

    // ---- remotes: see GitRepoRemote ----

    @Override
    public void fetch(String branch) throws GitAPIException {
        remote.fetch(branch);
    }

    @Override
    public void pull(String branch) throws GitAPIException {
        remote.pull(branch);
    }

    @Override
    public void push(String branch, boolean setUpstream) throws GitAPIException {
        remote.push(branch, setUpstream);
    }

    @Override
    public int getAheadCount(String branch) throws GitAPIException {
        return remote.getAheadCount(branch);
    }

    @Override
    public int getBehindCount(String branch) throws GitAPIException {
        return remote.getBehindCount(branch);
    }

    @Override
    public void close() {
        git.close();
        repository.close();
    }

    /** Passes {@link CommandFailure}s through and wraps anything else under {@code commandLine}. */
    static CommandFailure asFailure(String commandLine, GitAPIException e) {
        if (e instanceof CommandFailure failure) {
            return failure;
        }
        var message = e.getMessage() == null ? e.toString() : e.getMessage();
        return new CommandFailure(commandLine, 128, "fatal: " + message, e);
    }

    @Override
    public String toString() {
        return "GitRepo[" + workTree + "]";
    }

    public static class GitRepoException extends GitAPIException {
        public GitRepoException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class GitStateException extends GitAPIException {
        public GitStateException(String message) {
            super(message);
        }
    }

    public static class GitWrappedIOException extends CommandFailure {
        public GitWrappedIOException(String commandLine, IOException e) {
            super(commandLine, 128, "fatal: " + (e.getMessage() != null ? e.getMessage() : e.toString()), e);
        }
    }
}
