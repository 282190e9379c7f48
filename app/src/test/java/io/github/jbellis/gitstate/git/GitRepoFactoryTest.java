package io.github.jbellis.gitstate.git;

import static org.junit.jupiter.api.Assertions.*;

import io.github.jbellis.gitstate.util.GitStateSettings;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class GitRepoFactoryTest {
    @TempDir
    Path tempDir;

    private final GitStateSettings settings = GitStateSettings.load();

    @Test
    void testHasGitRepo() throws Exception {
        assertFalse(GitRepoFactory.hasGitRepo(tempDir));
        var root = GitFixtures.threeFiles(tempDir.resolve("repo"));
        assertTrue(GitRepoFactory.hasGitRepo(root));
        assertFalse(GitRepoFactory.hasGitRepo(root.resolve("subdir-1")));
    }

    @Test
    void testInitCreatesEmptyRepository() throws Exception {
        var root = tempDir.resolve("new/nested");
        var repo = GitRepoFactory.initRepo(root, settings);
        try {
            assertTrue(GitRepoFactory.hasGitRepo(root));
            assertTrue(repo.getHeadCommit().isUnborn());
            assertTrue(repo.getStatus().isClean());
        } finally {
            GitTestCleanupUtil.cleanupGitResources(repo);
        }
    }

    @Test
    void testCloneIntoEmptyDirectory() throws Exception {
        var fixture = GitFixtures.localAndRemote(tempDir.resolve("fixture"), false);
        var target = tempDir.resolve("clone");
        Files.createDirectories(target);

        var repo = GitRepoFactory.cloneRepo(fixture.remote().toUri().toString(), target, settings);
        try {
            assertEquals("third commit", repo.getHeadCommit().message());
            assertEquals("origin", repo.listRemotes().get(0).name());
        } finally {
            GitTestCleanupUtil.cleanupGitResources(repo);
        }
    }

    @Test
    void testCloneRefusesNonEmptyDirectory() throws Exception {
        var fixture = GitFixtures.localAndRemote(tempDir.resolve("fixture"), false);
        var target = tempDir.resolve("occupied");
        GitFixtures.write(target, "file.txt", "already here\n");

        var failure = assertThrows(
                CommandFailure.class,
                () -> GitRepoFactory.cloneRepo(fixture.remote().toUri().toString(), target, settings));
        assertEquals(128, failure.getExitCode());
        assertTrue(failure.getCommand().startsWith("git clone"));
    }
}
