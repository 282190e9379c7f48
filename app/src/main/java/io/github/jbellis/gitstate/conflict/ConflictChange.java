package io.github.jbellis.gitstate.conflict;

/** What happened to a conflicted path on one side of a merge, or in the working tree. */
public enum ConflictChange {
    ADDED,
    MODIFIED,
    DELETED,
    /** The working tree ended up with the same content HEAD has. */
    EQUIVALENT
}
