package io.github.jbellis.gitstate.cache;

/** A named set of keys, such as {@code ahead-count} or {@code file-patch:s}. */
public record CacheGroup(String name) implements Invalidatable {
    public static final CacheGroup UNSTAGED_FILE_PATCHES = new CacheGroup("file-patch:u");
    public static final CacheGroup STAGED_FILE_PATCHES = new CacheGroup("file-patch:s");
    public static final CacheGroup SYMBOLIC_COMMITS = new CacheGroup("commit:symbolic");

    @Override
    public String toString() {
        return name;
    }
}
