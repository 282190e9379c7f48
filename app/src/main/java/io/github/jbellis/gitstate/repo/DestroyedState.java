package io.github.jbellis.gitstate.repo;

/** Terminal. Resources have been released and every operation fails. */
final class DestroyedState extends UnavailableState {
    DestroyedState(Repository repository) {
        super(repository);
    }

    @Override
    public String name() {
        return "Destroyed";
    }

    @Override
    public boolean isDestroyed() {
        return true;
    }
}
