package io.github.jbellis.gitstate.patch;

import io.github.jbellis.gitstate.git.GitStatus;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Applies a {@link FilePatch} to the content of its old side. Context and removed lines must match exactly; there is
 * no fuzz and no offset search.
 */
public final class PatchApplier {
    private static final Logger logger = LogManager.getLogger(PatchApplier.class);

    private PatchApplier() {}

    /**
     * @param base the content the patch applies to, empty when the file does not exist
     * @return the patched content, or empty when the patch deletes the file
     */
    public static Optional<byte[]> apply(FilePatch patch, Optional<byte[]> base) throws PatchRejectedException {
        var path = patch.filePath();
        if (patch.status() == GitStatus.ADDED && base.isPresent()) {
            throw new PatchRejectedException(path, 0, "already exists");
        }
        if (patch.status() != GitStatus.ADDED && base.isEmpty()) {
            throw new PatchRejectedException(path, 0, "does not exist");
        }

        if (patch.hunks().isEmpty()) {
            return switch (patch.status()) {
                case ADDED -> Optional.of(new byte[0]);
                case DELETED -> Optional.empty();
                case RENAMED -> base;
                case MODIFIED -> throw new PatchRejectedException(path, 0, "patch has no hunks");
            };
        }

        var text = base.map(b -> new String(b, StandardCharsets.UTF_8)).orElse("");
        var baseLines = splitLines(text);
        boolean baseMissingNewline = !text.isEmpty() && !text.endsWith("\n");

        var out = new ArrayList<String>();
        int pos = 0;
        boolean missingNewline = false;
        for (var hunk : patch.hunks()) {
            int start = hunk.oldCount() == 0 ? hunk.oldStart() : hunk.oldStart() - 1;
            if (start < pos || start > baseLines.size()) {
                throw new PatchRejectedException(path, hunk.oldStart(), "hunk out of range");
            }
            while (pos < start) {
                out.add(baseLines.get(pos++));
            }
            LineStatus previous = null;
            for (var line : hunk.lines()) {
                switch (line.status()) {
                    case UNCHANGED, DELETED -> {
                        if (pos >= baseLines.size() || !baseLines.get(pos).equals(line.text())) {
                            throw new PatchRejectedException(path, pos + 1, "does not match \"" + line.text() + "\"");
                        }
                        if (line.status() == LineStatus.UNCHANGED) {
                            out.add(line.text());
                            missingNewline = false;
                        }
                        pos++;
                    }
                    case ADDED -> {
                        out.add(line.text());
                        missingNewline = false;
                    }
                    case NO_NEWLINE -> {
                        if (previous == LineStatus.ADDED || previous == LineStatus.UNCHANGED) {
                            missingNewline = true;
                        }
                    }
                }
                previous = line.status();
            }
        }
        boolean tailRemains = pos < baseLines.size();
        while (pos < baseLines.size()) {
            out.add(baseLines.get(pos++));
        }
        if (tailRemains) {
            missingNewline = baseMissingNewline;
        }

        if (patch.status() == GitStatus.DELETED) {
            if (!out.isEmpty()) {
                throw new PatchRejectedException(path, pos, "deletion leaves content behind");
            }
            return Optional.empty();
        }

        var result = String.join("\n", out);
        if (!out.isEmpty() && !missingNewline) {
            result += "\n";
        }
        logger.trace("Applied {} hunks to {}", patch.hunks().size(), path);
        return Optional.of(result.getBytes(StandardCharsets.UTF_8));
    }

    private static List<String> splitLines(String text) {
        var lines = new ArrayList<String>();
        if (text.isEmpty()) {
            return lines;
        }
        int start = 0;
        while (start < text.length()) {
            int nl = text.indexOf('\n', start);
            if (nl < 0) {
                lines.add(text.substring(start));
                break;
            }
            lines.add(text.substring(start, nl));
            start = nl + 1;
        }
        return lines;
    }
}
