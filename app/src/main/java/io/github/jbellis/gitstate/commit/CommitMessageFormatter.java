package io.github.jbellis.gitstate.commit;

import io.github.jbellis.gitstate.util.GitStateSettings;
import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes a commit message before it is handed to git:
 *
 * <ul>
 *   <li>lines whose first non-blank character is {@code #} are removed
 *   <li>the subject line is kept as typed
 *   <li>body lines are word-wrapped at the wrap column; a word longer than the column stays whole
 *   <li>trailing whitespace, leading blank lines and trailing blank lines are dropped
 * </ul>
 */
public class CommitMessageFormatter {
    public static final int DEFAULT_WRAP_COLUMN = 72;

    private final int wrapColumn;

    public CommitMessageFormatter() {
        this(DEFAULT_WRAP_COLUMN);
    }

    public CommitMessageFormatter(int wrapColumn) {
        if (wrapColumn <= 0) {
            throw new IllegalArgumentException("wrap column must be positive: " + wrapColumn);
        }
        this.wrapColumn = wrapColumn;
    }

    public static CommitMessageFormatter fromSettings(GitStateSettings settings) {
        return new CommitMessageFormatter(settings.wrapColumn());
    }

    public String format(String rawMessage) {
        var kept = new ArrayList<String>();
        for (var line : rawMessage.replace("\r\n", "\n").split("\n", -1)) {
            if (line.stripLeading().startsWith("#")) {
                continue;
            }
            kept.add(line.stripTrailing());
        }

        while (!kept.isEmpty() && kept.get(0).isEmpty()) {
            kept.remove(0);
        }
        while (!kept.isEmpty() && kept.get(kept.size() - 1).isEmpty()) {
            kept.remove(kept.size() - 1);
        }
        if (kept.isEmpty()) {
            return "";
        }

        var out = new ArrayList<String>();
        out.add(kept.get(0));
        for (var line : kept.subList(1, kept.size())) {
            out.addAll(wrap(line));
        }
        return String.join("\n", out);
    }

    /** Greedy wrap of one line; leading indentation is kept on its first piece. */
    List<String> wrap(String line) {
        if (line.length() <= wrapColumn) {
            return List.of(line);
        }
        int indentEnd = 0;
        while (indentEnd < line.length() && Character.isWhitespace(line.charAt(indentEnd))) {
            indentEnd++;
        }

        var pieces = new ArrayList<String>();
        var current = new StringBuilder(line.substring(0, indentEnd));
        boolean hasWord = false;
        for (var word : line.substring(indentEnd).split("\\s+")) {
            if (hasWord && current.length() + 1 + word.length() > wrapColumn) {
                pieces.add(current.toString());
                current = new StringBuilder();
                hasWord = false;
            }
            if (hasWord) {
                current.append(' ');
            }
            current.append(word);
            hasWord = true;
        }
        pieces.add(current.toString());
        return pieces;
    }
}
