package io.github.jbellis.gitstate.conflict;

import io.github.jbellis.gitstate.git.UnmergedPath;
import java.util.Arrays;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Classifies an unmerged path from its index stages plus the HEAD and working tree versions of the file.
 *
 * <p>{@code ours} and {@code theirs} compare each side with the merge base: no base means the side added the file,
 * a missing side means it deleted it. {@code file} compares the working tree with HEAD, so it follows whatever the
 * user does to the file while resolving, including deleting it.
 */
public final class ConflictClassifier {
    private ConflictClassifier() {}

    public static MergeConflict classify(UnmergedPath path, Optional<byte[]> head, Optional<byte[]> workingTree) {
        return new MergeConflict(
                path.path(),
                new ConflictStatus(
                        fileChange(head, workingTree),
                        sideChange(path.baseId(), path.oursId()),
                        sideChange(path.baseId(), path.theirsId())));
    }

    static ConflictChange sideChange(@Nullable String baseId, @Nullable String sideId) {
        if (baseId == null) {
            return ConflictChange.ADDED;
        }
        if (sideId == null) {
            return ConflictChange.DELETED;
        }
        return ConflictChange.MODIFIED;
    }

    static ConflictChange fileChange(Optional<byte[]> head, Optional<byte[]> workingTree) {
        if (head.isPresent() && workingTree.isPresent()) {
            return Arrays.equals(head.get(), workingTree.get()) ? ConflictChange.EQUIVALENT : ConflictChange.MODIFIED;
        }
        if (workingTree.isPresent()) {
            return ConflictChange.ADDED;
        }
        if (head.isPresent()) {
            return ConflictChange.DELETED;
        }
        return ConflictChange.EQUIVALENT;
    }
}
