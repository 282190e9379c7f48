package io.github.jbellis.gitstate.conflict;

public record MergeConflict(String filePath, ConflictStatus status) {}
