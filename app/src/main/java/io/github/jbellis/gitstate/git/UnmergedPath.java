package io.github.jbellis.gitstate.git;

import org.jetbrains.annotations.Nullable;

/** Index stages of a conflicted path; a null id means the stage is absent. */
public record UnmergedPath(
        String path, @Nullable String baseId, @Nullable String oursId, @Nullable String theirsId) {}
