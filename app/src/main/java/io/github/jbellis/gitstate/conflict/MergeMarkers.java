package io.github.jbellis.gitstate.conflict;

import java.util.regex.Pattern;

/** Detection of the conflict markers git writes into a file it could not merge. */
public final class MergeMarkers {
    // seven '<' or '>' at column 0, optionally followed by a single label
    private static final Pattern MARKER = Pattern.compile("^(<{7}|>{7})( \\S+)?$", Pattern.MULTILINE);

    private MergeMarkers() {}

    public static boolean hasMarkers(String text) {
        return MARKER.matcher(text.replace("\r\n", "\n")).find();
    }
}
