package io.github.jbellis.gitstate.cache;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Which cached reads each mutating operation can change. A key or group missing from an operation's entry must
 * survive that operation with its cached value untouched.
 */
public final class InvalidationTable {
    private InvalidationTable() {}

    public enum Operation {
        STAGE_FILES,
        UNSTAGE_FILES,
        STAGE_FILES_FROM_PARENT,
        APPLY_PATCH_TO_INDEX,
        CHECKOUT_SIDE,
        WRITE_MERGE_CONFLICT_TO_INDEX,
        CHECKOUT_PATHS_AT_REVISION,
        APPLY_PATCH_TO_WORKDIR,
        DISCARD_WORKDIR_CHANGES,
        UNDO_DISCARD,
        PERSIST_DISCARD_HISTORY,
        COMMIT,
        CHECKOUT,
        MERGE,
        ABORT_MERGE,
        FETCH,
        PULL,
        PUSH,
        SET_CONFIG,
        UNSET_CONFIG
    }

    /**
     * What an operation touched.
     *
     * @param paths files for the index and working tree operations
     * @param branch the branch for remote operations
     * @param configKey the key for config operations, or the key the discard history is persisted under
     */
    public record Scope(Collection<String> paths, @Nullable String branch, @Nullable String configKey) {
        public Scope {
            paths = List.copyOf(paths);
        }

        public static Scope none() {
            return new Scope(List.of(), null, null);
        }

        public static Scope paths(Collection<String> paths) {
            return new Scope(paths, null, null);
        }

        public static Scope branch(String branch) {
            return new Scope(List.of(), branch, null);
        }

        public static Scope configKey(String key) {
            return new Scope(List.of(), null, key);
        }

        /** Paths whose working tree files a discard touched, plus the config key the history is persisted under. */
        public static Scope discard(Collection<String> paths, String historyKey) {
            return new Scope(paths, null, historyKey);
        }

        String requireBranch(Operation op) {
            if (branch == null) {
                throw new IllegalArgumentException(op + " needs a branch");
            }
            return branch;
        }

        String requireConfigKey(Operation op) {
            if (configKey == null) {
                throw new IllegalArgumentException(op + " needs a config key");
            }
            return configKey;
        }
    }

    public static List<Invalidatable> keysFor(Operation op, Scope scope) {
        var result = new ArrayList<Invalidatable>();
        switch (op) {
            case STAGE_FILES,
                    UNSTAGE_FILES,
                    STAGE_FILES_FROM_PARENT,
                    APPLY_PATCH_TO_INDEX,
                    CHECKOUT_SIDE,
                    WRITE_MERGE_CONFLICT_TO_INDEX,
                    CHECKOUT_PATHS_AT_REVISION -> {
                result.addAll(List.of(
                        CacheKey.CHANGED_FILES,
                        CacheKey.STAGED_CHANGES,
                        CacheKey.STAGED_CHANGES_SINCE_PARENT,
                        CacheKey.MERGE_CONFLICTS));
                for (var path : scope.paths()) {
                    result.add(CacheKey.isPartiallyStaged(path));
                    result.add(CacheKey.filePatch(path, false, false));
                    result.add(CacheKey.filePatch(path, true, false));
                    result.add(CacheKey.filePatch(path, true, true));
                    result.add(CacheKey.index(path));
                }
            }
            case APPLY_PATCH_TO_WORKDIR, DISCARD_WORKDIR_CHANGES, UNDO_DISCARD -> {
                result.add(CacheKey.CHANGED_FILES);
                result.add(CacheKey.MERGE_CONFLICTS);
                for (var path : scope.paths()) {
                    result.add(CacheKey.isPartiallyStaged(path));
                    result.add(CacheKey.filePatch(path, false, false));
                }
                if (op != Operation.APPLY_PATCH_TO_WORKDIR && scope.configKey() != null) {
                    result.addAll(configKeys(scope.configKey()));
                }
            }
            case PERSIST_DISCARD_HISTORY -> result.addAll(configKeys(scope.requireConfigKey(op)));
            case COMMIT -> result.addAll(List.of(
                    CacheKey.CHANGED_FILES,
                    CacheKey.STAGED_CHANGES,
                    CacheKey.STAGED_CHANGES_SINCE_PARENT,
                    CacheKey.MERGE_CONFLICTS,
                    CacheKey.LAST_COMMIT,
                    CacheKey.BRANCHES,
                    KeyKind.IS_PARTIALLY_STAGED.group(),
                    CacheGroup.STAGED_FILE_PATCHES,
                    KeyKind.AHEAD_COUNT.group(),
                    CacheGroup.SYMBOLIC_COMMITS));
            case MERGE, ABORT_MERGE -> result.addAll(mergeKeys());
            case CHECKOUT -> result.addAll(List.of(
                    CacheKey.CHANGED_FILES,
                    CacheKey.STAGED_CHANGES,
                    CacheKey.STAGED_CHANGES_SINCE_PARENT,
                    CacheKey.MERGE_CONFLICTS,
                    CacheKey.LAST_COMMIT,
                    CacheKey.CURRENT_BRANCH,
                    KeyKind.IS_PARTIALLY_STAGED.group(),
                    KeyKind.FILE_PATCH.group(),
                    KeyKind.INDEX.group(),
                    CacheGroup.SYMBOLIC_COMMITS));
            case FETCH -> result.addAll(fetchKeys());
            case PULL -> {
                result.addAll(fetchKeys());
                for (var key : mergeKeys()) {
                    if (!result.contains(key)) {
                        result.add(key);
                    }
                }
            }
            case PUSH -> {
                var branch = scope.requireBranch(op);
                result.addAll(fetchKeys());
                result.add(CacheKey.REMOTES);
                for (var name : List.of("remote", "merge")) {
                    result.add(CacheKey.config("branch." + branch + "." + name, false));
                    result.add(CacheKey.config("branch." + branch + "." + name, true));
                }
            }
            case SET_CONFIG, UNSET_CONFIG -> result.addAll(configKeys(scope.requireConfigKey(op)));
        }
        return List.copyOf(result);
    }

    private static List<Invalidatable> configKeys(String key) {
        return List.of(CacheKey.config(key, false), CacheKey.config(key, true));
    }

    private static List<Invalidatable> mergeKeys() {
        return List.of(
                CacheKey.CHANGED_FILES,
                CacheKey.STAGED_CHANGES,
                CacheKey.STAGED_CHANGES_SINCE_PARENT,
                CacheKey.MERGE_CONFLICTS,
                CacheKey.LAST_COMMIT,
                CacheKey.BRANCHES,
                KeyKind.IS_PARTIALLY_STAGED.group(),
                KeyKind.FILE_PATCH.group(),
                KeyKind.INDEX.group(),
                KeyKind.AHEAD_COUNT.group(),
                KeyKind.BEHIND_COUNT.group(),
                CacheGroup.SYMBOLIC_COMMITS);
    }

    private static List<Invalidatable> fetchKeys() {
        return List.of(
                CacheKey.BRANCHES,
                KeyKind.AHEAD_COUNT.group(),
                KeyKind.BEHIND_COUNT.group(),
                CacheGroup.SYMBOLIC_COMMITS);
    }
}
