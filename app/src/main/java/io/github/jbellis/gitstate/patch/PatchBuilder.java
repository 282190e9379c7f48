package io.github.jbellis.gitstate.patch;

import io.github.jbellis.gitstate.git.GitStatus;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.eclipse.jgit.diff.DiffAlgorithm;
import org.eclipse.jgit.diff.EditList;
import org.eclipse.jgit.diff.RawText;
import org.eclipse.jgit.diff.RawTextComparator;
import org.jetbrains.annotations.Nullable;

/**
 * Builds {@link FilePatch}es from two versions of a file using JGit's histogram diff. Hunks are grouped the way
 * {@code git diff} groups them: changes closer than twice the context size share a hunk.
 */
public class PatchBuilder {
    public static final int DEFAULT_CONTEXT = 3;

    private final int context;
    private final DiffAlgorithm algorithm;

    public PatchBuilder() {
        this(DEFAULT_CONTEXT);
    }

    public PatchBuilder(int context) {
        this.context = context;
        this.algorithm = DiffAlgorithm.getAlgorithm(DiffAlgorithm.SupportedAlgorithm.HISTOGRAM);
    }

    /**
     * @param oldContent content on the old side, null if the file does not exist there
     * @param newContent content on the new side, null if the file does not exist there
     * @return the patch, or empty when both sides hold the same content (or neither exists)
     */
    public Optional<FilePatch> build(String path, byte @Nullable [] oldContent, byte @Nullable [] newContent) {
        return build(path, path, oldContent, newContent);
    }

    public Optional<FilePatch> build(
            String oldPath, String newPath, byte @Nullable [] oldContent, byte @Nullable [] newContent) {
        if (oldContent == null && newContent == null) {
            return Optional.empty();
        }
        if (oldContent != null && newContent != null && oldPath.equals(newPath)
                && Arrays.equals(oldContent, newContent)) {
            return Optional.empty();
        }

        GitStatus status;
        if (oldContent == null) {
            status = GitStatus.ADDED;
        } else if (newContent == null) {
            status = GitStatus.DELETED;
        } else {
            status = oldPath.equals(newPath) ? GitStatus.MODIFIED : GitStatus.RENAMED;
        }

        var oldBytes = Objects.requireNonNullElse(oldContent, new byte[0]);
        var newBytes = Objects.requireNonNullElse(newContent, new byte[0]);
        List<Hunk> hunks = RawText.isBinary(oldBytes) || RawText.isBinary(newBytes)
                ? List.of()
                : buildHunks(new RawText(oldBytes), new RawText(newBytes));

        return Optional.of(new FilePatch(
                oldContent == null ? null : oldPath, newContent == null ? null : newPath, status, hunks));
    }

    List<Hunk> buildHunks(RawText a, RawText b) {
        var edits = algorithm.diff(RawTextComparator.DEFAULT, a, b);

        var hunks = new ArrayList<Hunk>();
        int curIdx = 0;
        while (curIdx < edits.size()) {
            int endIdx = findCombinedEnd(edits, curIdx);
            var first = edits.get(curIdx);
            var last = edits.get(endIdx);

            int aCur = Math.max(0, first.getBeginA() - context);
            int bCur = Math.max(0, first.getBeginB() - context);
            int aEnd = Math.min(a.size(), last.getEndA() + context);
            int bEnd = Math.min(b.size(), last.getEndB() + context);
            int aStart = aCur;
            int bStart = bCur;

            var lines = new ArrayList<Line>();
            for (int i = curIdx; i <= endIdx; i++) {
                var edit = edits.get(i);
                while (aCur < edit.getBeginA()) {
                    addContext(lines, a, b, aCur++, bCur++);
                }
                for (; aCur < edit.getEndA(); aCur++) {
                    lines.add(Line.deleted(a.getString(aCur), aCur + 1));
                    addMarkerIfLast(lines, a, aCur);
                }
                for (; bCur < edit.getEndB(); bCur++) {
                    lines.add(Line.added(b.getString(bCur), bCur + 1));
                    addMarkerIfLast(lines, b, bCur);
                }
            }
            while (aCur < aEnd && bCur < bEnd) {
                addContext(lines, a, b, aCur++, bCur++);
            }

            int oldCount = aEnd - aStart;
            int newCount = bEnd - bStart;
            hunks.add(new Hunk(
                    oldCount == 0 ? aStart : aStart + 1,
                    oldCount,
                    newCount == 0 ? bStart : bStart + 1,
                    newCount,
                    "",
                    lines));
            curIdx = endIdx + 1;
        }
        return hunks;
    }

    private static void addContext(List<Line> lines, RawText a, RawText b, int aIdx, int bIdx) {
        lines.add(Line.unchanged(a.getString(aIdx), aIdx + 1, bIdx + 1));
        addMarkerIfLast(lines, a, aIdx);
    }

    private static void addMarkerIfLast(List<Line> lines, RawText text, int idx) {
        if (idx == text.size() - 1 && text.isMissingNewlineAtEnd()) {
            lines.add(Line.noNewline());
        }
    }

    private int findCombinedEnd(EditList edits, int i) {
        int end = i + 1;
        while (end < edits.size()
                && (edits.get(end).getBeginA() - edits.get(end - 1).getEndA() <= 2 * context
                        || edits.get(end).getBeginB() - edits.get(end - 1).getEndB() <= 2 * context)) {
            end++;
        }
        return end - 1;
    }
}
