package io.github.jbellis.gitstate.cache;

/** The kinds of cached reads. Each kind is also a group holding all of its keys. */
public enum KeyKind {
    CHANGED_FILES("changed-files", false),
    STAGED_CHANGES("staged-changes", false),
    STAGED_CHANGES_SINCE_PARENT("staged-changes-since-parent", false),
    MERGE_CONFLICTS("merge-conflicts", false),
    IS_PARTIALLY_STAGED("is-partially-staged", true),
    FILE_PATCH("file-patch", true),
    INDEX("index", true),
    LAST_COMMIT("last-commit", false),
    BRANCHES("branches", false),
    CURRENT_BRANCH("current-branch", false),
    REMOTES("remotes", false),
    AHEAD_COUNT("ahead-count", true),
    BEHIND_COUNT("behind-count", true),
    CONFIG("config", true),
    COMMIT("commit", true);

    private final String prefix;
    private final boolean scoped;

    KeyKind(String prefix, boolean scoped) {
        this.prefix = prefix;
        this.scoped = scoped;
    }

    public String prefix() {
        return prefix;
    }

    /** Whether keys of this kind carry a scope (a path, branch, config key or ref). */
    public boolean isScoped() {
        return scoped;
    }

    public CacheGroup group() {
        return new CacheGroup(prefix);
    }
}
