package io.github.jbellis.gitstate.patch;

import io.github.jbellis.gitstate.git.GitStatus;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;

/**
 * The changes to one file. {@code oldPath} is null for an added file and {@code newPath} is null for a deleted one.
 * A patch without hunks is either an empty file being added or removed, or binary content.
 */
public record FilePatch(@Nullable String oldPath, @Nullable String newPath, GitStatus status, List<Hunk> hunks) {
    public FilePatch {
        if (oldPath == null && newPath == null) {
            throw new IllegalArgumentException("a patch needs at least one path");
        }
        hunks = List.copyOf(hunks);
    }

    /** The path this patch is about: the new path, or the old one for a deletion. */
    public String filePath() {
        return Objects.requireNonNullElse(newPath, Objects.requireNonNull(oldPath));
    }

    /** The patch that undoes this one when applied to the result of applying it. */
    public FilePatch getUnstagePatch() {
        var inverted =
                switch (status) {
                    case ADDED -> GitStatus.DELETED;
                    case DELETED -> GitStatus.ADDED;
                    case MODIFIED, RENAMED -> status;
                };
        return new FilePatch(
                newPath, oldPath, inverted, hunks.stream().map(Hunk::inverted).toList());
    }

    /**
     * A patch holding only {@code selectedLines}, for applying to this patch's old side. Unselected deletions become
     * context and unselected additions are dropped.
     */
    public FilePatch getStagePatchForLines(Set<Line> selectedLines) {
        var partial = new ArrayList<Hunk>();
        int delta = 0;
        boolean keepsAllDeletions = true;
        for (var hunk : hunks) {
            var lines = new ArrayList<Line>();
            boolean previousKept = true;
            for (var line : hunk.lines()) {
                switch (line.status()) {
                    case UNCHANGED -> {
                        lines.add(line);
                        previousKept = true;
                    }
                    case DELETED -> {
                        if (selectedLines.contains(line)) {
                            lines.add(line);
                        } else {
                            lines.add(new Line(LineStatus.UNCHANGED, line.text(), line.oldLineNumber(), 0));
                            keepsAllDeletions = false;
                        }
                        previousKept = true;
                    }
                    case ADDED -> {
                        previousKept = selectedLines.contains(line);
                        if (previousKept) {
                            lines.add(line);
                        }
                    }
                    case NO_NEWLINE -> {
                        if (previousKept) {
                            lines.add(line);
                        }
                    }
                }
            }
            if (lines.stream().noneMatch(Line::isChange)) {
                continue;
            }
            var renumbered = renumber(hunk, lines, delta);
            delta += renumbered.newCount() - renumbered.oldCount();
            partial.add(renumbered);
        }

        if (status == GitStatus.DELETED && !keepsAllDeletions) {
            return new FilePatch(oldPath, oldPath, GitStatus.MODIFIED, partial);
        }
        return new FilePatch(oldPath, newPath, status, partial);
    }

    /**
     * A patch that takes {@code selectedLines} back out, for applying to this patch's new side (the index, for a
     * staged patch).
     */
    public FilePatch getUnstagePatchForLines(Set<Line> selectedLines) {
        var invertedSelection = selectedLines.stream().map(Line::inverted).collect(Collectors.toSet());
        return getUnstagePatch().getStagePatchForLines(invertedSelection);
    }

    /**
     * Keeps the old side of {@code original} and renumbers the new side, which starts {@code delta} lines away from
     * the old side because of earlier hunks.
     */
    private static Hunk renumber(Hunk original, List<Line> lines, int delta) {
        int oldCount = 0;
        int newCount = 0;
        for (var line : lines) {
            if (line.status() == LineStatus.UNCHANGED || line.status() == LineStatus.DELETED) {
                oldCount++;
            }
            if (line.status() == LineStatus.UNCHANGED || line.status() == LineStatus.ADDED) {
                newCount++;
            }
        }
        int firstOld = original.oldCount() == 0 ? original.oldStart() + 1 : original.oldStart();
        int firstNew = firstOld + delta;

        var result = new ArrayList<Line>(lines.size());
        int newLine = firstNew;
        for (var line : lines) {
            result.add(
                    switch (line.status()) {
                        case UNCHANGED -> new Line(LineStatus.UNCHANGED, line.text(), line.oldLineNumber(), newLine++);
                        case ADDED -> new Line(LineStatus.ADDED, line.text(), Line.NO_LINE, newLine++);
                        case DELETED, NO_NEWLINE -> line;
                    });
        }
        int newStart = newCount == 0 ? firstNew - 1 : firstNew;
        return new Hunk(original.oldStart(), oldCount, newStart, newCount, original.heading(), result);
    }

    /** Unified diff text, as {@code git diff} would print it for this file. */
    public String toPatchString() {
        var sb = new StringBuilder();
        var a = oldPath == null ? "/dev/null" : "a/" + oldPath;
        var b = newPath == null ? "/dev/null" : "b/" + newPath;
        sb.append("diff --git a/")
                .append(oldPath == null ? newPath : oldPath)
                .append(" b/")
                .append(newPath == null ? oldPath : newPath)
                .append('\n');
        switch (status) {
            case ADDED -> sb.append("new file mode 100644\n");
            case DELETED -> sb.append("deleted file mode 100644\n");
            case RENAMED -> sb.append("rename from ")
                    .append(oldPath)
                    .append("\nrename to ")
                    .append(newPath)
                    .append('\n');
            case MODIFIED -> {}
        }
        if (hunks.isEmpty()) {
            return sb.toString();
        }
        sb.append("--- ").append(a).append('\n').append("+++ ").append(b).append('\n');
        for (var hunk : hunks) {
            sb.append(hunk.header()).append('\n');
            for (var line : hunk.lines()) {
                sb.append(line.toPatchLine()).append('\n');
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "FilePatch[" + status + " " + filePath() + ", " + hunks.size() + " hunks]";
    }
}
