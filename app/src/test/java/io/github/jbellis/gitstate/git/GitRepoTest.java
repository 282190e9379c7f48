package io.github.jbellis.gitstate.git;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import io.github.jbellis.gitstate.util.GitStateSettings;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class GitRepoTest {
    @TempDir
    Path tempDir;

    private Path root;
    private GitRepo repo;

    @BeforeEach
    void setUp() throws Exception {
        root = GitFixtures.threeFiles(tempDir.resolve("three-files"));
        repo = new GitRepo(root);
    }

    @AfterEach
    void tearDown() {
        GitTestCleanupUtil.cleanupGitResources(repo);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testConstructorRejectsNonRepository() {
        var plain = tempDir.resolve("plain");
        assertThrows(IllegalArgumentException.class, () -> new GitRepo(plain));
    }

    @Test
    void testStatusOfCleanTree() throws Exception {
        assertTrue(repo.getStatus().isClean());
    }

    @Test
    void testStatusSeparatesStagedAndUnstaged() throws Exception {
        GitFixtures.write(root, "a.txt", "changed\n");
        Files.delete(root.resolve("b.txt"));
        GitFixtures.write(root, "new.txt", "new\n");
        GitFixtures.write(root, "c.txt", "staged\n");
        repo.stage(List.of("c.txt"));

        var status = repo.getStatus();
        assertEquals(GitStatus.MODIFIED, status.unstaged().get("a.txt"));
        assertEquals(GitStatus.DELETED, status.unstaged().get("b.txt"));
        assertEquals(GitStatus.ADDED, status.unstaged().get("new.txt"));
        assertEquals(List.of("c.txt"), List.copyOf(status.staged().keySet()));
        assertEquals(GitStatus.MODIFIED, status.staged().get("c.txt"));
    }

    @Test
    void testStageAndUnstageDeletion() throws Exception {
        Files.delete(root.resolve("a.txt"));
        repo.stage(List.of("a.txt"));
        assertEquals(GitStatus.DELETED, repo.getStatus().staged().get("a.txt"));
        assertTrue(repo.readIndexContent("a.txt").isEmpty());

        repo.unstage(List.of("a.txt"));
        var status = repo.getStatus();
        assertTrue(status.staged().isEmpty());
        assertEquals(GitStatus.DELETED, status.unstaged().get("a.txt"));
    }

    @Test
    void testUnstageAddedFileMakesItUntracked() throws Exception {
        GitFixtures.write(root, "subdir-1/e.txt", "e\n");
        repo.stage(List.of("subdir-1/e.txt"));
        assertEquals(GitStatus.ADDED, repo.getStatus().staged().get("subdir-1/e.txt"));

        repo.unstage(List.of("subdir-1/e.txt"));
        assertEquals(GitStatus.ADDED, repo.getStatus().unstaged().get("subdir-1/e.txt"));
        assertTrue(repo.getStatus().staged().isEmpty());
    }

    @Test
    void testReadersSeeEachLayer() throws Exception {
        GitFixtures.write(root, "a.txt", "index\n");
        repo.stage(List.of("a.txt"));
        GitFixtures.write(root, "a.txt", "worktree\n");

        assertEquals(
                "foo\n", new String(repo.readCommitContent("HEAD", "a.txt").orElseThrow(), StandardCharsets.UTF_8));
        assertEquals("index\n", new String(repo.readIndexContent("a.txt").orElseThrow(), StandardCharsets.UTF_8));
        assertEquals(
                "worktree\n", new String(repo.readWorkingTreeContent("a.txt").orElseThrow(), StandardCharsets.UTF_8));
        assertTrue(repo.readCommitContent("HEAD", "missing.txt").isEmpty());
        assertTrue(repo.readIndexContent("missing.txt").isEmpty());
        assertTrue(repo.readWorkingTreeContent("missing.txt").isEmpty());
    }

    @Test
    void testWriteIndexEntryLeavesWorkingTreeAlone() throws Exception {
        repo.writeIndexEntry("a.txt", bytes("written\n"));

        var status = repo.getStatus();
        assertEquals(GitStatus.MODIFIED, status.staged().get("a.txt"));
        assertEquals(GitStatus.MODIFIED, status.unstaged().get("a.txt"));
        assertEquals("foo\n", GitFixtures.read(root, "a.txt"));

        repo.writeIndexEntry("a.txt", null);
        assertEquals(GitStatus.DELETED, repo.getStatus().staged().get("a.txt"));
    }

    @Test
    void testStagedStatusesAgainstParent() throws Exception {
        GitFixtures.write(root, "a.txt", "changed\n");
        repo.stage(List.of("a.txt"));
        assertEquals(List.of(new ChangedFile("a.txt", GitStatus.MODIFIED)), repo.getStagedStatusesAgainst("HEAD"));
    }

    @Test
    void testStageFromCommit() throws Exception {
        GitFixtures.write(root, "a.txt", "changed\n");
        repo.stage(List.of("a.txt"));
        repo.stageFromCommit("HEAD", List.of("a.txt"));

        assertEquals("foo\n", new String(repo.readIndexContent("a.txt").orElseThrow(), StandardCharsets.UTF_8));
        assertEquals("changed\n", GitFixtures.read(root, "a.txt"));
    }

    @Test
    void testRestoreFromIndexDiscardsWorkingTreeChanges() throws Exception {
        GitFixtures.write(root, "a.txt", "changed\n");
        Files.delete(root.resolve("b.txt"));
        GitFixtures.write(root, "untracked.txt", "new\n");

        repo.restoreFromIndex(List.of("a.txt", "b.txt", "untracked.txt"));

        assertTrue(repo.getStatus().isClean());
        assertEquals("foo\n", GitFixtures.read(root, "a.txt"));
        assertTrue(Files.exists(root.resolve("b.txt")));
        assertFalse(Files.exists(root.resolve("untracked.txt")));
    }

    @Test
    void testObjects() throws Exception {
        var content = bytes("blob content\n");
        var hashed = repo.hashObject(content);
        var written = repo.writeObject(content);
        assertEquals(hashed, written);
        assertArrayEquals(content, repo.readObject(written));

        var failure = assertThrows(
                CommandFailure.class, () -> repo.readObject("1111111111111111111111111111111111111111"));
        assertEquals(128, failure.getExitCode());
    }

    @Test
    void testConfig() throws Exception {
        assertTrue(repo.getConfig("gitstate.missing", true).isEmpty());

        repo.setConfig("gitstate.some-key", "value");
        assertEquals("value", repo.getConfig("gitstate.some-key", false).orElseThrow());
        assertEquals("value", repo.getConfig("gitstate.some-key", true).orElseThrow());

        repo.setConfig("branch.master.remote", "origin");
        assertEquals("origin", repo.getConfig("branch.master.remote", true).orElseThrow());

        repo.unsetConfig("gitstate.some-key");
        assertTrue(repo.getConfig("gitstate.some-key", false).isEmpty());

        var failure = assertThrows(CommandFailure.class, () -> repo.getConfig("nosection", false));
        assertEquals(1, failure.getExitCode());
    }

    @Test
    void testCommitAndHead() throws Exception {
        assertEquals("Initial commit", repo.getHeadCommit().message());

        GitFixtures.write(root, "a.txt", "changed\n");
        repo.stage(List.of("a.txt"));
        repo.commit("Second\n\n# kept verbatim\n", false, false);

        var head = repo.getHeadCommit();
        assertEquals("Second", head.subject());
        assertTrue(head.message().contains("# kept verbatim"));
        assertEquals("Initial commit", repo.getCommit("HEAD~").message());
    }

    @Test
    void testCommitWithNothingStagedFails() {
        var failure = assertThrows(CommandFailure.class, () -> repo.commit("empty", false, false));
        assertEquals(1, failure.getExitCode());
        assertTrue(failure.getCommand().startsWith("git commit"));
    }

    @Test
    void testAmendKeepsParent() throws Exception {
        var before = repo.getHeadCommit();
        repo.commit("Amended", true, true);

        var after = repo.getHeadCommit();
        assertNotEquals(before.sha(), after.sha());
        assertEquals("Amended", after.message());
    }

    @Test
    void testUnknownRevisionFails() {
        var failure = assertThrows(CommandFailure.class, () -> repo.getCommit("no-such-ref"));
        assertEquals(128, failure.getExitCode());
    }

    @Test
    void testUnbornHead() throws Exception {
        var empty = GitRepoFactory.initRepo(tempDir.resolve("empty"), GitStateSettings.load());
        try {
            var head = empty.getHeadCommit();
            assertTrue(head.isUnborn());
            assertEquals("", head.sha());
        } finally {
            GitTestCleanupUtil.cleanupGitResources(empty);
        }
    }

    @Test
    void testBranches() throws Exception {
        assertEquals("master", repo.getCurrentBranch());
        var branches = repo.listBranches();
        assertEquals(1, branches.size());
        assertEquals("master", branches.get(0).name());
        assertEquals(repo.getHeadCommit().sha(), branches.get(0).sha());
        assertTrue(repo.listRemotes().isEmpty());
    }

    private String commitOnFeatureBranch() throws Exception {
        var initial = repo.getHeadCommit().sha();
        repo.getGit().branchCreate().setName("feature").call();
        GitFixtures.write(root, "b.txt", "master change\n");
        repo.stage(List.of("b.txt"));
        repo.commit("Master change", false, false);
        return initial;
    }

    @Test
    void testCheckoutBranchAndCommit() throws Exception {
        var initial = commitOnFeatureBranch();

        repo.checkout("feature");
        assertEquals("feature", repo.getCurrentBranch());
        assertEquals("bar\n", GitFixtures.read(root, "b.txt"));

        repo.checkout("master");
        repo.checkout(initial);
        assertEquals(initial, repo.getHeadCommit().sha());
        assertTrue(initial.startsWith(repo.getCurrentBranch()));
    }

    @Test
    void testCheckoutFailures() throws Exception {
        commitOnFeatureBranch();

        var unknown = assertThrows(CommandFailure.class, () -> repo.checkout("no-such-branch"));
        assertEquals(1, unknown.getExitCode());
        assertEquals("git checkout no-such-branch", unknown.getCommand());
        assertTrue(unknown.getStderr().contains("did not match any file(s) known to git"));

        GitFixtures.write(root, "b.txt", "uncommitted\n");
        var dirty = assertThrows(CommandFailure.class, () -> repo.checkout("feature"));
        assertEquals(1, dirty.getExitCode());
        assertTrue(dirty.getStderr().contains("b.txt"));
        assertEquals("master", repo.getCurrentBranch());
        assertEquals("uncommitted\n", GitFixtures.read(root, "b.txt"));
    }

    @Test
    void testCheckoutPathsAtRevision() throws Exception {
        commitOnFeatureBranch();
        GitFixtures.write(root, "a.txt", "edited\n");

        repo.checkoutPathsAtRevision(List.of("b.txt", "a.txt"), "HEAD~");

        assertEquals("bar\n", GitFixtures.read(root, "b.txt"));
        assertEquals("bar\n", new String(repo.readIndexContent("b.txt").orElseThrow(), StandardCharsets.UTF_8));
        assertEquals("foo\n", GitFixtures.read(root, "a.txt"));
        assertEquals("master", repo.getCurrentBranch());

        var badRevision = assertThrows(
                CommandFailure.class, () -> repo.checkoutPathsAtRevision(List.of("a.txt"), "no-such-ref"));
        assertEquals(128, badRevision.getExitCode());
        var missingPath = assertThrows(
                CommandFailure.class, () -> repo.checkoutPathsAtRevision(List.of("missing.txt"), "HEAD"));
        assertEquals(1, missingPath.getExitCode());
        assertTrue(missingPath.getStderr().contains("missing.txt"));
    }

    @Test
    void testAbortWithoutMergeFails() {
        var failure = assertThrows(CommandFailure.class, repo::abortMerge);
        assertEquals(128, failure.getExitCode());
        assertTrue(failure.getStderr().contains("There is no merge to abort"));
    }

    @Test
    void testExecRunsGitExecutable() throws Exception {
        assumeTrue(gitAvailable(), "git executable not available");

        var result = repo.exec(List.of("rev-parse", "--abbrev-ref", "HEAD"));
        assertTrue(result.succeeded());
        assertEquals("master", result.stdout().strip());

        var failed = repo.exec(List.of("rev-parse", "--verify", "no-such-ref"));
        assertNotEquals(0, failed.exitCode());
        assertFalse(failed.stderr().isBlank());
    }

    private static boolean gitAvailable() {
        try {
            var process = new ProcessBuilder("git", "--version").redirectErrorStream(true).start();
            process.getInputStream().transferTo(OutputStream.nullOutputStream());
            return process.waitFor() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
