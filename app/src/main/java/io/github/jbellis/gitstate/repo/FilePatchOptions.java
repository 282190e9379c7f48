package io.github.jbellis.gitstate.repo;

/**
 * Which two versions of a file a patch compares.
 *
 * <ul>
 *   <li>unstaged: index to working tree
 *   <li>staged: HEAD to index
 *   <li>staged and amending: HEAD's parent to index, i.e. what the amended commit would contain
 * </ul>
 *
 * {@code amending} only matters for staged patches.
 */
public record FilePatchOptions(boolean staged, boolean amending) {
    public static final FilePatchOptions UNSTAGED = new FilePatchOptions(false, false);
    public static final FilePatchOptions STAGED = new FilePatchOptions(true, false);
    public static final FilePatchOptions STAGED_AMENDING = new FilePatchOptions(true, true);

    public FilePatchOptions {
        amending = staged && amending;
    }
}
