package io.github.jbellis.gitstate.patch;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A contiguous diff region. Starts follow unified diff conventions: 1-based, and when a side is empty its start is the
 * line before the region.
 */
public record Hunk(int oldStart, int oldCount, int newStart, int newCount, String heading, List<Line> lines) {
    public Hunk {
        lines = List.copyOf(lines);
    }

    public String header() {
        return "@@ -" + oldStart + "," + oldCount + " +" + newStart + "," + newCount + " @@"
                + (heading.isEmpty() ? "" : " " + heading);
    }

    public boolean hasChanges() {
        return lines.stream().anyMatch(Line::isChange);
    }

    /**
     * The hunk that undoes this one. Sides are swapped and, within each run of changed lines, deletions come before
     * additions. A no-newline marker stays attached to the line it followed.
     */
    Hunk inverted() {
        var result = new ArrayList<Line>(lines.size());
        var deletions = new ArrayList<Line>();
        var additions = new ArrayList<Line>();
        @Nullable List<Line> lastRun = null;

        for (var line : lines) {
            var flipped = line.inverted();
            switch (flipped.status()) {
                case DELETED -> {
                    deletions.add(flipped);
                    lastRun = deletions;
                }
                case ADDED -> {
                    additions.add(flipped);
                    lastRun = additions;
                }
                case NO_NEWLINE -> {
                    if (lastRun != null) {
                        lastRun.add(flipped);
                    } else {
                        result.add(flipped);
                    }
                }
                case UNCHANGED -> {
                    flushRun(result, deletions, additions);
                    lastRun = null;
                    result.add(flipped);
                }
            }
        }
        flushRun(result, deletions, additions);
        return new Hunk(newStart, newCount, oldStart, oldCount, heading, result);
    }

    private static void flushRun(List<Line> result, List<Line> deletions, List<Line> additions) {
        result.addAll(deletions);
        result.addAll(additions);
        deletions.clear();
        additions.clear();
    }
}
