package io.github.jbellis.gitstate.git;

import org.jetbrains.annotations.Nullable;

/**
 * A local branch.
 *
 * @param name short name, e.g. {@code master}
 * @param sha commit the branch points at, or null for an unborn branch
 * @param upstream the tracked remote branch, e.g. {@code refs/remotes/origin/master}, if configured
 */
public record Branch(String name, @Nullable String sha, @Nullable String upstream) {}
