package io.github.jbellis.gitstate.git;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Snapshot of {@code git status}: staged changes (HEAD vs index), unstaged changes (index vs working tree) and the
 * conflicted paths. Conflicted paths appear in neither map. Everything iterates in path order.
 */
public record WorkingTreeStatus(
        SortedMap<String, GitStatus> staged, SortedMap<String, GitStatus> unstaged, SortedSet<String> conflicted) {
    public WorkingTreeStatus {
        staged = Collections.unmodifiableSortedMap(new TreeMap<>(staged));
        unstaged = Collections.unmodifiableSortedMap(new TreeMap<>(unstaged));
        conflicted = Collections.unmodifiableSortedSet(new TreeSet<>(conflicted));
    }

    public static WorkingTreeStatus of(
            Map<String, GitStatus> staged, Map<String, GitStatus> unstaged, Set<String> conflicted) {
        return new WorkingTreeStatus(new TreeMap<>(staged), new TreeMap<>(unstaged), new TreeSet<>(conflicted));
    }

    public boolean isClean() {
        return staged.isEmpty() && unstaged.isEmpty() && conflicted.isEmpty();
    }
}
