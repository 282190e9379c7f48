package io.github.jbellis.gitstate.discard;

import org.jetbrains.annotations.Nullable;

/**
 * Content of one file before and after a discard, as blob ids in the content store. A null id means the file did not
 * exist at that point.
 */
public record DiscardSnapshot(String filePath, @Nullable String beforeSha, @Nullable String afterSha) {}
