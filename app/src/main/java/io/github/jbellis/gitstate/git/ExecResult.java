package io.github.jbellis.gitstate.git;

/** Outcome of running the git executable. */
public record ExecResult(int exitCode, String stdout, String stderr) {
    public boolean succeeded() {
        return exitCode == 0;
    }
}
