package io.github.jbellis.gitstate.git;

/** Represents the status of a file in a diff or status listing. */
public enum GitStatus {
    /** File was added (A) */
    ADDED,

    /** File was modified (M) */
    MODIFIED,

    /** File was deleted (D) */
    DELETED,

    /** File was renamed (R); only produced for patches that carry both paths */
    RENAMED
}
