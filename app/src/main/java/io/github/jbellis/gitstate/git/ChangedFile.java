package io.github.jbellis.gitstate.git;

/** A path with pending changes on one side of the index, as listed by status. */
public record ChangedFile(String filePath, GitStatus status) {}
