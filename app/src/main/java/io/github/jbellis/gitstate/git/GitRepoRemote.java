package io.github.jbellis.gitstate.git;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.BranchConfig;
import org.eclipse.jgit.lib.BranchTrackingStatus;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.transport.PushResult;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.transport.RemoteRefUpdate;
import org.jetbrains.annotations.Nullable;

/**
 * Encapsulates remote-related operations for a GitRepo. A branch talks to the remote named by
 * {@code branch.<name>.remote} ({@code origin} when unset) and to the remote branch named by
 * {@code branch.<name>.merge} (the same name when unset).
 */
public class GitRepoRemote {
    private static final Logger logger = LogManager.getLogger(GitRepoRemote.class);

    private static final String DEFAULT_REMOTE = "origin";

    private final GitRepo repo;
    private final Git git;
    private final Repository repository;

    GitRepoRemote(GitRepo repo) {
        this.repo = repo;
        this.git = repo.getGit();
        this.repository = repo.getRepository();
    }

    /** Determines if a push operation was successful for a specific ref update. */
    public static boolean isPushSuccessful(RemoteRefUpdate.Status status) {
        return status == RemoteRefUpdate.Status.OK || status == RemoteRefUpdate.Status.UP_TO_DATE;
    }

    private record Upstream(String remote, String remoteBranch) {
        String trackingRef() {
            return "refs/remotes/" + remote + "/" + remoteBranch;
        }
    }

    private Upstream upstreamOf(String branch) {
        var config = new BranchConfig(repository.getConfig(), branch);
        var remote = config.getRemote();
        var merge = config.getMerge();
        return new Upstream(
                remote == null ? DEFAULT_REMOTE : remote, merge == null ? branch : Repository.shortenRefName(merge));
    }

    private int timeoutSeconds() {
        return (int) repo.getSettings().networkTimeout().toSeconds();
    }

    /** Updates the remote-tracking ref of {@code branch} without touching the branch itself. */
    public void fetch(String branch) throws GitAPIException {
        var upstream = upstreamOf(branch);
        var commandLine = "git fetch " + upstream.remote() + " " + upstream.remoteBranch();
        logger.debug("Fetching {} from {}", upstream.remoteBranch(), upstream.remote());
        var refSpec = new RefSpec("+refs/heads/" + upstream.remoteBranch() + ":" + upstream.trackingRef());
        try {
            git.fetch()
                    .setRemote(upstream.remote())
                    .setRefSpecs(refSpec)
                    .setTimeout(timeoutSeconds())
                    .call();
        } catch (GitAPIException e) {
            throw GitRepo.asFailure(commandLine, e);
        }
    }

    /** Fetches, then merges the remote-tracking ref into the current branch. */
    public void pull(String branch) throws GitAPIException {
        var upstream = upstreamOf(branch);
        var commandLine = "git pull " + upstream.remote() + " " + upstream.remoteBranch();
        try {
            fetch(branch);
            repo.merge(upstream.trackingRef());
        } catch (CommandFailure e) {
            throw new CommandFailure(commandLine, e.getExitCode(), e.getStderr(), e);
        }
    }

    /**
     * Pushes {@code branch} to the branch of the same name on its remote. With {@code setUpstream} the local branch
     * is configured to track what was pushed.
     */
    public void push(String branch, boolean setUpstream) throws GitAPIException {
        assert !branch.isBlank();

        var remoteName = upstreamOf(branch).remote();
        var commandLine = "git push " + (setUpstream ? "--set-upstream " : "") + remoteName + " " + branch;
        logger.debug("Pushing branch {} to {}", branch, remoteName);
        var refSpec = new RefSpec(String.format("refs/heads/%s:refs/heads/%s", branch, branch));

        Iterable<PushResult> results;
        try {
            results = git.push()
                    .setRemote(remoteName)
                    .setRefSpecs(refSpec)
                    .setTimeout(timeoutSeconds())
                    .call();
        } catch (GitAPIException e) {
            throw GitRepo.asFailure(commandLine, e);
        }

        List<String> rejectionMessages = new ArrayList<>();
        for (var result : results) {
            for (var rru : result.getRemoteUpdates()) {
                var status = rru.getStatus();
                if (!isPushSuccessful(status)) {
                    String message = " ! [rejected] " + branch + " -> " + branch + " (";
                    if (status == RemoteRefUpdate.Status.REJECTED_NONFASTFORWARD
                            || status == RemoteRefUpdate.Status.REJECTED_REMOTE_CHANGED) {
                        message += "fetch first)";
                    } else {
                        message += status + (rru.getMessage() != null ? ": " + rru.getMessage() : "") + ")";
                    }
                    rejectionMessages.add(message);
                }
            }
        }
        if (!rejectionMessages.isEmpty()) {
            throw new CommandFailure(
                    commandLine,
                    1,
                    String.join("\n", rejectionMessages) + "\nerror: failed to push some refs to '" + remoteName + "'");
        }

        if (setUpstream) {
            // same monitor as GitRepo.setConfig and unsetConfig, which rewrite the same file
            synchronized (repo) {
                var config = repository.getConfig();
                config.setString("branch", branch, "remote", remoteName);
                config.setString("branch", branch, "merge", "refs/heads/" + branch);
                try {
                    config.save();
                } catch (IOException e) {
                    throw new GitRepo.GitWrappedIOException(commandLine, e);
                }
            }
        }
    }

    public int getAheadCount(String branch) throws GitAPIException {
        var status = trackingStatus(branch);
        return status == null ? 0 : status.getAheadCount();
    }

    public int getBehindCount(String branch) throws GitAPIException {
        var status = trackingStatus(branch);
        return status == null ? 0 : status.getBehindCount();
    }

    private @Nullable BranchTrackingStatus trackingStatus(String branch) throws GitAPIException {
        try {
            return BranchTrackingStatus.of(repository, branch);
        } catch (IOException e) {
            throw new GitRepo.GitWrappedIOException("git rev-list --left-right --count " + branch + "...@{u}", e);
        }
    }
}
