package io.github.jbellis.gitstate.repo;

import static io.github.jbellis.gitstate.repo.RepositoryTestUtil.await;
import static io.github.jbellis.gitstate.repo.RepositoryTestUtil.open;
import static org.junit.jupiter.api.Assertions.*;

import io.github.jbellis.gitstate.discard.DiscardSnapshot;
import io.github.jbellis.gitstate.git.ChangedFile;
import io.github.jbellis.gitstate.git.GitFixtures;
import io.github.jbellis.gitstate.git.GitRepo;
import io.github.jbellis.gitstate.git.GitStatus;
import io.github.jbellis.gitstate.git.GitTestCleanupUtil;
import io.github.jbellis.gitstate.util.GitStateSettings;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class RepositoryDiscardHistoryTest {
    private static final String HISTORY_KEY = GitStateSettings.load().discardHistoryConfigKey();
    private static final List<String> CHANGED = List.of("a.txt", "b.txt", "subdir-1/e.txt");

    @TempDir
    Path tempDir;

    private Path root;
    private Repository repository;
    private @Nullable Repository reopened;

    @BeforeEach
    void setUp() throws Exception {
        root = GitFixtures.threeFiles(tempDir.resolve("three-files"));
        repository = open(root);
    }

    @AfterEach
    void tearDown() {
        GitTestCleanupUtil.cleanupGitResources(repository, reopened);
    }

    private void makeChanges() throws Exception {
        GitFixtures.write(root, "a.txt", "modified\n");
        Files.delete(root.resolve("b.txt"));
        GitFixtures.write(root, "subdir-1/e.txt", "added\n");
    }

    @Test
    void testDiscardRevertsModifiedRemovedAndAddedFiles() throws Exception {
        makeChanges();
        assertEquals(
                List.of(
                        new ChangedFile("a.txt", GitStatus.MODIFIED),
                        new ChangedFile("b.txt", GitStatus.DELETED),
                        new ChangedFile("subdir-1/e.txt", GitStatus.ADDED)),
                await(repository.getUnstagedChanges()));

        await(repository.discardWorkDirChangesForPaths(CHANGED));

        assertEquals(List.of(), await(repository.getUnstagedChanges()));
        assertEquals("foo\n", GitFixtures.read(root, "a.txt"));
        assertTrue(Files.exists(root.resolve("b.txt")));
        assertFalse(Files.exists(root.resolve("subdir-1/e.txt")));

        assertTrue(await(repository.hasDiscardHistory(null)));
        var snapshots = await(repository.getLastHistorySnapshots(null));
        assertEquals(CHANGED, snapshots.stream().map(DiscardSnapshot::filePath).toList());
        assertNull(snapshots.get(1).beforeSha());
        assertNull(snapshots.get(2).afterSha());
    }

    @Test
    void testUndoLastDiscard() throws Exception {
        makeChanges();
        await(repository.discardWorkDirChangesForPaths(CHANGED));

        var conflicts = await(repository.undoLastDiscard(null));

        assertEquals(List.of(), conflicts);
        assertEquals("modified\n", GitFixtures.read(root, "a.txt"));
        assertFalse(Files.exists(root.resolve("b.txt")));
        assertEquals("added\n", GitFixtures.read(root, "subdir-1/e.txt"));
        assertFalse(await(repository.hasDiscardHistory(null)));
        assertEquals(3, await(repository.getUnstagedChanges()).size());
    }

    @Test
    void testUndoLeavesFilesChangedSinceTheDiscard() throws Exception {
        makeChanges();
        await(repository.discardWorkDirChangesForPaths(CHANGED));
        GitFixtures.write(root, "a.txt", "edited after discard\n");

        var conflicts = await(repository.undoLastDiscard(null));

        assertEquals(List.of("a.txt"), conflicts);
        assertEquals("edited after discard\n", GitFixtures.read(root, "a.txt"));
        assertFalse(Files.exists(root.resolve("b.txt")));
        assertTrue(await(repository.hasDiscardHistory(null)));
    }

    @Test
    void testPartialHistoryIsKeptPerGroup() throws Exception {
        GitFixtures.write(root, "a.txt", "partial\n");

        var stored = await(repository.storeBeforeAndAfterBlobs(
                List.of("a.txt"),
                path -> true,
                () -> GitFixtures.write(root, "a.txt", "foo\n"),
                "a.txt"));

        assertEquals(1, stored.size());
        assertTrue(await(repository.hasDiscardHistory("a.txt")));
        assertFalse(await(repository.hasDiscardHistory(null)));
        assertEquals(List.of(stored), await(repository.getDiscardHistory("a.txt")));

        await(repository.popDiscardHistory("a.txt"));
        assertFalse(await(repository.hasDiscardHistory("a.txt")));
    }

    @Test
    void testUnsafePathsAreLeftAlone() throws Exception {
        makeChanges();

        var stored = await(repository.storeBeforeAndAfterBlobs(
                CHANGED, path -> false, () -> fail("nothing is safe to discard"), null));

        assertEquals(List.of(), stored);
        assertFalse(await(repository.hasDiscardHistory(null)));
    }

    @Test
    void testClearDiscardHistory() throws Exception {
        makeChanges();
        await(repository.discardWorkDirChangesForPaths(List.of("a.txt")));
        await(repository.discardWorkDirChangesForPaths(List.of("b.txt")));
        assertEquals(2, await(repository.getDiscardHistory(null)).size());

        await(repository.clearDiscardHistory(null));

        assertEquals(List.of(), await(repository.getDiscardHistory(null)));
    }

    private void assertCachedHistoryKeyIsCurrent() throws Exception {
        try (var git = new GitRepo(root)) {
            for (var local : List.of(false, true)) {
                assertEquals(git.getConfig(HISTORY_KEY, local), await(repository.getConfig(HISTORY_KEY, local)));
            }
        }
    }

    @Test
    void testCachedHistoryKeyFollowsEveryHistoryWrite() throws Exception {
        makeChanges();
        assertCachedHistoryKeyIsCurrent();

        await(repository.discardWorkDirChangesForPaths(List.of("a.txt")));
        assertTrue(await(repository.getConfig(HISTORY_KEY, true)).isPresent());
        assertCachedHistoryKeyIsCurrent();

        await(repository.discardWorkDirChangesForPaths(List.of("b.txt")));
        assertCachedHistoryKeyIsCurrent();

        await(repository.undoLastDiscard(null));
        assertCachedHistoryKeyIsCurrent();

        await(repository.popDiscardHistory(null));
        assertCachedHistoryKeyIsCurrent();

        await(repository.storeBeforeAndAfterBlobs(
                List.of("c.txt"), p -> true, () -> GitFixtures.write(root, "c.txt", "rewritten\n"), null));
        assertCachedHistoryKeyIsCurrent();

        await(repository.clearDiscardHistory(null));
        assertCachedHistoryKeyIsCurrent();
    }

    @Test
    void testHistoryIsRestoredByNewInstance() throws Exception {
        makeChanges();
        await(repository.discardWorkDirChangesForPaths(CHANGED));
        var blob = await(repository.createDiscardHistoryBlob());
        var history = await(repository.getDiscardHistory(null));
        repository.destroy();

        reopened = open(root);

        assertEquals(blob, await(reopened.createDiscardHistoryBlob()));
        assertEquals(history, await(reopened.getDiscardHistory(null)));
        assertEquals(blob, await(reopened.getConfig(HISTORY_KEY, true)).orElseThrow());
    }

    @Test
    void testUnreadableHistoryStartsEmpty() throws Exception {
        var missingBlob = "1111111111111111111111111111111111111111";
        await(repository.setConfig(HISTORY_KEY, missingBlob));
        await(repository.updateDiscardHistory());
        repository.destroy();

        // point the key at a blob that does not exist, with nothing running that could overwrite it
        try (var git = new GitRepo(root)) {
            git.setConfig(HISTORY_KEY, missingBlob);
        }

        reopened = open(root);

        assertTrue(reopened.isPresent());
        assertEquals(List.of(), await(reopened.getDiscardHistory(null)));
        assertFalse(await(reopened.hasDiscardHistory(null)));
    }
}
