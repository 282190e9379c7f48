package io.github.jbellis.gitstate.repo;

/** Placeholder for "probably no repository here" before any directory has been checked. */
final class AbsentGuessState extends UnavailableState {
    AbsentGuessState(Repository repository) {
        super(repository);
    }

    @Override
    public String name() {
        return "AbsentGuess";
    }

    @Override
    public boolean isAbsent() {
        return true;
    }

    @Override
    public boolean showGitTabInit() {
        return true;
    }
}
