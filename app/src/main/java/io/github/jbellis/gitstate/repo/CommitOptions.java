package io.github.jbellis.gitstate.repo;

public record CommitOptions(boolean amend, boolean allowEmpty) {
    public static final CommitOptions DEFAULT = new CommitOptions(false, false);

    public static CommitOptions amending() {
        return new CommitOptions(true, false);
    }

    public static CommitOptions allowingEmpty() {
        return new CommitOptions(false, true);
    }
}
