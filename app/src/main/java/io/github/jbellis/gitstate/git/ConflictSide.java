package io.github.jbellis.gitstate.git;

/** Which side of a conflicted merge to keep. */
public enum ConflictSide {
    OURS,
    THEIRS
}
