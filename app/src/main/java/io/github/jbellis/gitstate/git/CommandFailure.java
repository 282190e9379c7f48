package io.github.jbellis.gitstate.git;

import org.eclipse.jgit.api.errors.GitAPIException;
import org.jetbrains.annotations.Nullable;

/**
 * A git operation that did not complete. Carries the command line the operation corresponds to, the exit code the
 * git executable reports (or would report) and its stderr, so callers can render a diagnostic.
 */
public class CommandFailure extends GitAPIException {
    private final String command;
    private final int exitCode;
    private final String stderr;

    public CommandFailure(String command, int exitCode, String stderr) {
        this(command, exitCode, stderr, null);
    }

    public CommandFailure(String command, int exitCode, String stderr, @Nullable Throwable cause) {
        super(command + " exited with " + exitCode + (stderr.isBlank() ? "" : ": " + stderr.strip()), cause);
        this.command = command;
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    public String getCommand() {
        return command;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStderr() {
        return stderr;
    }
}
