package io.github.jbellis.gitstate.git;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class GitRepoRemoteTest {
    @TempDir
    Path tempDir;

    private GitRepo repo;

    @AfterEach
    void tearDown() {
        GitTestCleanupUtil.cleanupGitResources(repo);
    }

    private GitFixtures.LocalAndRemote open(boolean remoteAhead) throws Exception {
        var fixture = GitFixtures.localAndRemote(tempDir, remoteAhead);
        repo = new GitRepo(fixture.local());
        return fixture;
    }

    @Test
    void testCloneTracksOrigin() throws Exception {
        var fixture = open(false);

        var remotes = repo.listRemotes();
        assertEquals(1, remotes.size());
        assertEquals("origin", remotes.get(0).name());
        assertTrue(remotes.get(0).url().contains(fixture.remote().getFileName().toString()));
        assertEquals("origin", repo.getConfig("branch.master.remote", false).orElseThrow());
        assertEquals("refs/remotes/origin/master", repo.listBranches().get(0).upstream());
    }

    @Test
    void testFetchUpdatesTrackingRefOnly() throws Exception {
        var fixture = open(true);
        assertEquals(0, repo.getBehindCount("master"));

        repo.fetch("master");

        assertEquals("second commit", GitFixtures.headMessage(fixture.local(), "master"));
        assertEquals("third commit", GitFixtures.headMessage(fixture.local(), "origin/master"));
        assertEquals(1, repo.getBehindCount("master"));
        assertEquals(0, repo.getAheadCount("master"));
    }

    @Test
    void testPullMergesRemoteChanges() throws Exception {
        var fixture = open(true);

        repo.pull("master");

        assertEquals("third commit", GitFixtures.headMessage(fixture.local(), "master"));
        assertEquals("third commit", GitFixtures.headMessage(fixture.local(), "origin/master"));
        assertEquals(0, repo.getBehindCount("master"));
    }

    @Test
    void testPushUpdatesRemote() throws Exception {
        var fixture = open(false);
        repo.commit("fourth commit", false, true);
        repo.commit("fifth commit", false, true);
        assertEquals(2, repo.getAheadCount("master"));

        repo.push("master", false);

        assertEquals("fifth commit", GitFixtures.headMessage(fixture.remote(), "master"));
        assertEquals("fifth commit", GitFixtures.headMessage(fixture.local(), "origin/master"));
        assertEquals(0, repo.getAheadCount("master"));
    }

    @Test
    void testPushRejectedWhenRemoteMovedOn() throws Exception {
        open(true);
        repo.commit("local commit", false, true);

        var failure = assertThrows(CommandFailure.class, () -> repo.push("master", false));
        assertEquals(1, failure.getExitCode());
        assertTrue(failure.getStderr().contains("[rejected]"));
    }

    @Test
    void testPushWithUpstreamConfiguresNewBranch() throws Exception {
        var fixture = open(false);
        repo.getGit().checkout().setCreateBranch(true).setName("feature").call();
        repo.commit("feature commit", false, true);
        assertTrue(repo.getConfig("branch.feature.remote", false).isEmpty());

        repo.push("feature", true);

        assertEquals("origin", repo.getConfig("branch.feature.remote", false).orElseThrow());
        assertEquals("refs/heads/feature", repo.getConfig("branch.feature.merge", false).orElseThrow());
        assertEquals("feature commit", GitFixtures.headMessage(fixture.remote(), "feature"));
    }

    @Test
    void testUpstreamConfigIsWrittenUnderTheRepoMonitor() throws Exception {
        open(false);
        repo.getGit().checkout().setCreateBranch(true).setName("feature").call();
        repo.commit("feature commit", false, true);
        var error = new AtomicReference<Throwable>();
        var pusher = new Thread(() -> {
            try {
                repo.push("feature", true);
            } catch (Throwable t) {
                error.set(t);
            }
        });

        synchronized (repo) {
            pusher.start();
            long deadline = System.nanoTime() + 30_000_000_000L;
            while (pusher.getState() != Thread.State.BLOCKED && pusher.isAlive()) {
                assertTrue(System.nanoTime() < deadline, "push never waited for the monitor");
                Thread.sleep(10);
            }
            assertTrue(pusher.isAlive(), "push finished without the monitor");
            assertTrue(repo.getConfig("branch.feature.remote", false).isEmpty());
        }

        pusher.join(30_000);
        assertNull(error.get());
        assertEquals("origin", repo.getConfig("branch.feature.remote", false).orElseThrow());
    }

    @Test
    void testCountsWithoutUpstreamAreZero() throws Exception {
        open(false);
        repo.getGit().checkout().setCreateBranch(true).setName("local-only").call();
        repo.commit("unpushed", false, true);

        assertEquals(0, repo.getAheadCount("local-only"));
        assertEquals(0, repo.getBehindCount("local-only"));
    }
}
