package io.github.jbellis.gitstate.git;

import java.time.Instant;
import org.eclipse.jgit.revwalk.RevCommit;

/**
 * Commit metadata. The unborn commit stands in for HEAD in a repository without commits.
 *
 * @param message full message without the trailing newline
 */
public record CommitInfo(String sha, String message, String authorName, String authorEmail, Instant date) {
    private static final CommitInfo UNBORN = new CommitInfo("", "", "", "", Instant.EPOCH);

    public static CommitInfo unborn() {
        return UNBORN;
    }

    public static CommitInfo fromRevCommit(RevCommit commit) {
        var author = commit.getAuthorIdent();
        return new CommitInfo(
                commit.getName(),
                stripTrailingNewlines(commit.getFullMessage()),
                author.getName(),
                author.getEmailAddress(),
                author.getWhenAsInstant());
    }

    public boolean isUnborn() {
        return sha.isEmpty();
    }

    /** First line of the message. */
    public String subject() {
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }

    private static String stripTrailingNewlines(String message) {
        int end = message.length();
        while (end > 0 && message.charAt(end - 1) == '\n') {
            end--;
        }
        return message.substring(0, end);
    }
}
