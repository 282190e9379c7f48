package io.github.jbellis.gitstate.cache;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A structured cache key: a {@link KeyKind} plus the scope the read was made for. The string form, e.g.
 * {@code file-patch:s:amending:a.txt}, is only for logging; equality is structural.
 */
public record CacheKey(KeyKind kind, String scope) implements Invalidatable {
    private static final Pattern FULL_OBJECT_ID = Pattern.compile("[0-9a-f]{40}");

    public CacheKey {
        if (kind.isScoped() == scope.isEmpty()) {
            throw new IllegalArgumentException(kind + (kind.isScoped() ? " needs a scope" : " takes no scope"));
        }
    }

    public static CacheKey of(KeyKind kind) {
        return new CacheKey(kind, "");
    }

    public static final CacheKey CHANGED_FILES = of(KeyKind.CHANGED_FILES);
    public static final CacheKey STAGED_CHANGES = of(KeyKind.STAGED_CHANGES);
    public static final CacheKey STAGED_CHANGES_SINCE_PARENT = of(KeyKind.STAGED_CHANGES_SINCE_PARENT);
    public static final CacheKey MERGE_CONFLICTS = of(KeyKind.MERGE_CONFLICTS);
    public static final CacheKey LAST_COMMIT = of(KeyKind.LAST_COMMIT);
    public static final CacheKey BRANCHES = of(KeyKind.BRANCHES);
    public static final CacheKey CURRENT_BRANCH = of(KeyKind.CURRENT_BRANCH);
    public static final CacheKey REMOTES = of(KeyKind.REMOTES);

    public static CacheKey isPartiallyStaged(String path) {
        return new CacheKey(KeyKind.IS_PARTIALLY_STAGED, path);
    }

    public static CacheKey filePatch(String path, boolean staged, boolean amending) {
        String scope;
        if (!staged) {
            scope = "u:" + path;
        } else {
            scope = amending ? "s:amending:" + path : "s:" + path;
        }
        return new CacheKey(KeyKind.FILE_PATCH, scope);
    }

    public static CacheKey index(String path) {
        return new CacheKey(KeyKind.INDEX, path);
    }

    public static CacheKey aheadCount(String branch) {
        return new CacheKey(KeyKind.AHEAD_COUNT, branch);
    }

    public static CacheKey behindCount(String branch) {
        return new CacheKey(KeyKind.BEHIND_COUNT, branch);
    }

    public static CacheKey config(String key, boolean local) {
        return new CacheKey(KeyKind.CONFIG, local ? key + ":local" : key);
    }

    public static CacheKey commit(String ref) {
        return new CacheKey(KeyKind.COMMIT, ref);
    }

    /** Groups this key belongs to: its kind, plus the staged/unstaged split for patches and symbolic commit refs. */
    public Set<CacheGroup> groups() {
        var groups = new LinkedHashSet<CacheGroup>();
        groups.add(kind.group());
        if (kind == KeyKind.FILE_PATCH) {
            groups.add(scope.startsWith("u:") ? CacheGroup.UNSTAGED_FILE_PATCHES : CacheGroup.STAGED_FILE_PATCHES);
        } else if (kind == KeyKind.COMMIT && !FULL_OBJECT_ID.matcher(scope).matches()) {
            groups.add(CacheGroup.SYMBOLIC_COMMITS);
        }
        return groups;
    }

    public boolean isIn(CacheGroup group) {
        return groups().contains(group);
    }

    @Override
    public String toString() {
        return scope.isEmpty() ? kind.prefix() : kind.prefix() + ":" + scope;
    }
}
