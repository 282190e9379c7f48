package io.github.jbellis.gitstate.repo;

import static io.github.jbellis.gitstate.repo.RepositoryTestUtil.await;
import static io.github.jbellis.gitstate.repo.RepositoryTestUtil.failure;
import static io.github.jbellis.gitstate.repo.RepositoryTestUtil.open;
import static org.junit.jupiter.api.Assertions.*;

import io.github.jbellis.gitstate.conflict.ConflictChange;
import io.github.jbellis.gitstate.conflict.ConflictStatus;
import io.github.jbellis.gitstate.conflict.MergeConflict;
import io.github.jbellis.gitstate.git.ChangedFile;
import io.github.jbellis.gitstate.git.CommandFailure;
import io.github.jbellis.gitstate.git.ConflictSide;
import io.github.jbellis.gitstate.git.GitFixtures;
import io.github.jbellis.gitstate.git.GitStatus;
import io.github.jbellis.gitstate.git.GitTestCleanupUtil;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.eclipse.jgit.api.Git;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class RepositoryMergeConflictTest {
    @TempDir
    Path tempDir;

    private @Nullable Repository repository;
    private Path root;

    @AfterEach
    void tearDown() {
        GitTestCleanupUtil.cleanupGitResources(repository);
    }

    private Repository mergeConflict() throws Exception {
        root = GitFixtures.mergeConflict(tempDir.resolve("merge-conflict"));
        repository = open(root);
        var error = assertInstanceOf(CommandFailure.class, failure(repository.merge("branch")));
        assertTrue(error.getStderr().contains("CONFLICT"));
        return repository;
    }

    private Repository mergeConflictAbort() throws Exception {
        root = GitFixtures.mergeConflictAbort(tempDir.resolve("merge-conflict-abort"));
        repository = open(root);
        assertInstanceOf(CommandFailure.class, failure(repository.merge("spanish")));
        return repository;
    }

    private static Map<String, ConflictStatus> byPath(List<MergeConflict> conflicts) {
        return conflicts.stream().collect(Collectors.toMap(MergeConflict::filePath, MergeConflict::status));
    }

    @Test
    void testClassifiesConflicts() throws Exception {
        var repo = mergeConflict();
        assertTrue(await(repo.isMerging()));

        var conflicts = byPath(await(repo.getMergeConflicts()));
        assertEquals(5, conflicts.size());

        assertEquals(
                new ConflictStatus(ConflictChange.MODIFIED, ConflictChange.ADDED, ConflictChange.ADDED),
                conflicts.get("added-to-both.txt"));
        assertEquals(
                new ConflictStatus(ConflictChange.MODIFIED, ConflictChange.MODIFIED, ConflictChange.MODIFIED),
                conflicts.get("modified-on-both-ours.txt"));
        assertEquals(
                new ConflictStatus(ConflictChange.MODIFIED, ConflictChange.MODIFIED, ConflictChange.MODIFIED),
                conflicts.get("modified-on-both-theirs.txt"));

        var removedOnBranch = conflicts.get("removed-on-branch.txt");
        assertEquals(ConflictChange.MODIFIED, removedOnBranch.ours());
        assertEquals(ConflictChange.DELETED, removedOnBranch.theirs());
        // the working tree keeps our version, which is what HEAD has
        var expectedBranchFile = Files.exists(root.resolve("removed-on-branch.txt"))
                        && GitFixtures.read(root, "removed-on-branch.txt").equals("master modification\n")
                ? ConflictChange.EQUIVALENT
                : ConflictChange.MODIFIED;
        assertEquals(expectedBranchFile, removedOnBranch.file());

        var removedOnMaster = conflicts.get("removed-on-master.txt");
        assertEquals(ConflictChange.DELETED, removedOnMaster.ours());
        assertEquals(ConflictChange.MODIFIED, removedOnMaster.theirs());
        var expectedMasterFile = Files.exists(root.resolve("removed-on-master.txt"))
                ? ConflictChange.ADDED
                : ConflictChange.EQUIVALENT;
        assertEquals(expectedMasterFile, removedOnMaster.file());
    }

    @Test
    void testFileStatusFollowsWorkingTree() throws Exception {
        var repo = mergeConflict();
        await(repo.getMergeConflicts());

        Files.deleteIfExists(root.resolve("removed-on-branch.txt"));
        repo.refresh();

        var conflicts = byPath(await(repo.getMergeConflicts()));
        assertEquals(ConflictChange.DELETED, conflicts.get("removed-on-branch.txt").file());
    }

    @Test
    void testConflictedPathsAreNotListedAsChanges() throws Exception {
        var repo = mergeConflict();
        var status = await(repo.getStatusesForChangedFiles());

        assertEquals(5, status.conflicted().size());
        for (var path : status.conflicted()) {
            assertFalse(status.staged().containsKey(path), path);
            assertFalse(status.unstaged().containsKey(path), path);
        }
    }

    @Test
    void testStagingResolvesConflicts() throws Exception {
        var repo = mergeConflict();
        Function<List<ChangedFile>, Map<String, GitStatus>> asMap =
                list -> list.stream().collect(Collectors.toMap(ChangedFile::filePath, ChangedFile::status));

        GitFixtures.write(root, "modified-on-both-ours.txt", "master modification\n");
        await(repo.stageFiles(List.of("modified-on-both-ours.txt")));
        assertFalse(asMap.apply(await(repo.getStagedChanges())).containsKey("modified-on-both-ours.txt"));

        GitFixtures.write(root, "modified-on-both-theirs.txt", "branch modification\n");
        await(repo.stageFiles(List.of("modified-on-both-theirs.txt")));
        assertEquals(
                GitStatus.MODIFIED, asMap.apply(await(repo.getStagedChanges())).get("modified-on-both-theirs.txt"));

        Files.deleteIfExists(root.resolve("removed-on-branch.txt"));
        await(repo.stageFiles(List.of("removed-on-branch.txt")));
        assertEquals(GitStatus.DELETED, asMap.apply(await(repo.getStagedChanges())).get("removed-on-branch.txt"));

        Files.deleteIfExists(root.resolve("removed-on-master.txt"));
        await(repo.stageFiles(List.of("removed-on-master.txt")));
        assertFalse(asMap.apply(await(repo.getStagedChanges())).containsKey("removed-on-master.txt"));

        var remaining = byPath(await(repo.getMergeConflicts())).keySet();
        assertEquals(Set.of("added-to-both.txt"), remaining);
    }

    @Test
    void testPathHasMergeMarkers() throws Exception {
        var repo = mergeConflict();
        assertTrue(await(repo.pathHasMergeMarkers("added-to-both.txt")));
        assertTrue(await(repo.pathHasMergeMarkers("modified-on-both-ours.txt")));
        assertFalse(await(repo.pathHasMergeMarkers("removed-on-master.txt")));
        assertFalse(await(repo.pathHasMergeMarkers("no-such-file.txt")));
    }

    @Test
    void testCheckoutSide() throws Exception {
        var repo = mergeConflict();

        await(repo.checkoutSide(ConflictSide.OURS, List.of("modified-on-both-ours.txt")));
        await(repo.checkoutSide(ConflictSide.THEIRS, List.of("modified-on-both-theirs.txt")));

        assertEquals("master modification\n", GitFixtures.read(root, "modified-on-both-ours.txt"));
        assertEquals("branch modification\n", GitFixtures.read(root, "modified-on-both-theirs.txt"));
        var remaining = byPath(await(repo.getMergeConflicts()));
        assertFalse(remaining.containsKey("modified-on-both-ours.txt"));
        assertFalse(remaining.containsKey("modified-on-both-theirs.txt"));
        assertFalse(await(repo.pathHasMergeMarkers("modified-on-both-theirs.txt")));
    }

    @Test
    void testAbortMerge() throws Exception {
        var repo = mergeConflictAbort();
        assertTrue(await(repo.isMerging()));
        assertEquals(1, await(repo.getMergeConflicts()).size());

        await(repo.abortMerge());

        assertFalse(await(repo.isMerging()));
        assertEquals(List.of(), await(repo.getMergeConflicts()));
        assertEquals(List.of(), await(repo.getStagedChanges()));
        assertEquals(List.of(), await(repo.getUnstagedChanges()));
        assertEquals("dog\n", GitFixtures.read(root, "animal.txt"));
    }

    @Test
    void testAbortKeepsUnrelatedChanges() throws Exception {
        var repo = mergeConflictAbort();
        GitFixtures.write(root, "fruit.txt", "a change\n");

        await(repo.abortMerge());

        assertFalse(await(repo.isMerging()));
        assertEquals(0, await(repo.getStagedChanges()).size());
        assertEquals(1, await(repo.getUnstagedChanges()).size());
        assertEquals("a change\n", GitFixtures.read(root, "fruit.txt"));
    }

    @Test
    void testAbortFailsWhenConflictedFileWasEdited() throws Exception {
        var repo = mergeConflictAbort();
        GitFixtures.write(root, "animal.txt", "a change\n");
        repo.refresh();
        var stagedBefore = await(repo.getStagedChanges());
        var unstagedBefore = await(repo.getUnstagedChanges());

        var error = assertInstanceOf(CommandFailure.class, failure(repo.abortMerge()));

        assertTrue(error.getCommand().startsWith("git merge --abort"));
        assertTrue(await(repo.isMerging()));
        assertEquals(stagedBefore, await(repo.getStagedChanges()));
        assertEquals(unstagedBefore, await(repo.getUnstagedChanges()));
    }

    @Test
    void testCleanMergeCommits() throws Exception {
        root = GitFixtures.threeFiles(tempDir.resolve("three-files"));
        try (var git = Git.open(root.toFile())) {
            git.checkout().setCreateBranch(true).setName("feature").call();
            GitFixtures.write(root, "a.txt", "feature\n");
            GitFixtures.commitAll(git, "Feature");
            git.checkout().setName("master").call();
        }
        repository = open(root);
        var before = await(repository.getLastCommit());

        await(repository.merge("feature"));

        assertNotEquals(before.sha(), await(repository.getLastCommit()).sha());
        assertFalse(await(repository.isMerging()));
        assertEquals("feature\n", await(repository.readFileFromIndex("a.txt")).orElseThrow());
    }
}
