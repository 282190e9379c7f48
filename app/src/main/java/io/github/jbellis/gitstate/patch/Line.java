package io.github.jbellis.gitstate.patch;

/**
 * One line of a hunk. Line numbers are 1-based; {@link #NO_LINE} marks a side the line does not exist on.
 *
 * @param text the line without its terminator
 */
public record Line(LineStatus status, String text, int oldLineNumber, int newLineNumber) {
    public static final int NO_LINE = -1;

    public static final String NO_NEWLINE_TEXT = " No newline at end of file";

    public static Line added(String text, int newLineNumber) {
        return new Line(LineStatus.ADDED, text, NO_LINE, newLineNumber);
    }

    public static Line deleted(String text, int oldLineNumber) {
        return new Line(LineStatus.DELETED, text, oldLineNumber, NO_LINE);
    }

    public static Line unchanged(String text, int oldLineNumber, int newLineNumber) {
        return new Line(LineStatus.UNCHANGED, text, oldLineNumber, newLineNumber);
    }

    public static Line noNewline() {
        return new Line(LineStatus.NO_NEWLINE, NO_NEWLINE_TEXT, NO_LINE, NO_LINE);
    }

    public boolean isChange() {
        return status.isChange();
    }

    /** Same text on the other side of the diff. */
    Line inverted() {
        var flipped =
                switch (status) {
                    case ADDED -> LineStatus.DELETED;
                    case DELETED -> LineStatus.ADDED;
                    case UNCHANGED, NO_NEWLINE -> status;
                };
        return new Line(flipped, text, newLineNumber, oldLineNumber);
    }

    public String toPatchLine() {
        return status.origin() + text;
    }
}
