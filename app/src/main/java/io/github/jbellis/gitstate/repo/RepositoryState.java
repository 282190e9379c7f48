package io.github.jbellis.gitstate.repo;

/**
 * One lifecycle state of a {@link Repository}. The set of states is closed, and each of the three families defines
 * every operation:
 *
 * <ul>
 *   <li>{@link DeferredState}: waits for loading to finish, then hands the call to the state reached
 *   <li>{@link UnavailableState}: fails with {@link NotReadyException}
 *   <li>{@link PresentState}: does the work
 * </ul>
 */
public sealed interface RepositoryState extends RepositoryOperations
        permits DeferredState, UnavailableState, PresentState {

    /** The state's name as {@link Repository#isInState} expects it, e.g. {@code "AbsentGuess"}. */
    String name();

    default boolean isLoading() {
        return false;
    }

    default boolean isPresent() {
        return false;
    }

    default boolean isAbsent() {
        return false;
    }

    /** True when the working directory is known to hold no repository. */
    default boolean isEmpty() {
        return false;
    }

    default boolean isDestroyed() {
        return false;
    }

    default boolean showGitTabLoading() {
        return false;
    }

    default boolean showGitTabInit() {
        return false;
    }
}
