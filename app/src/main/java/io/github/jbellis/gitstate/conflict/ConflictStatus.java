package io.github.jbellis.gitstate.conflict;

/**
 * @param file the working tree compared to HEAD
 * @param ours our side compared to the merge base
 * @param theirs their side compared to the merge base
 */
public record ConflictStatus(ConflictChange file, ConflictChange ours, ConflictChange theirs) {}
