package io.github.jbellis.gitstate.patch;

/** A patch whose context or removed lines do not match the content it was applied to. */
public class PatchRejectedException extends Exception {
    private final String path;
    private final int lineNumber;

    public PatchRejectedException(String path, int lineNumber, String message) {
        super(path + ":" + lineNumber + ": " + message);
        this.path = path;
        this.lineNumber = lineNumber;
    }

    public String getPath() {
        return path;
    }

    /** 1-based line of the base content where the mismatch was found. */
    public int getLineNumber() {
        return lineNumber;
    }
}
