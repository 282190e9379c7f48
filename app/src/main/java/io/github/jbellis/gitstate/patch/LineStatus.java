package io.github.jbellis.gitstate.patch;

public enum LineStatus {
    ADDED('+'),
    DELETED('-'),
    UNCHANGED(' '),
    /** The "\ No newline at end of file" marker; it applies to the line before it. */
    NO_NEWLINE('\\');

    private final char origin;

    LineStatus(char origin) {
        this.origin = origin;
    }

    /** The prefix character of this kind of line in unified diff output. */
    public char origin() {
        return origin;
    }

    public boolean isChange() {
        return this == ADDED || this == DELETED;
    }
}
