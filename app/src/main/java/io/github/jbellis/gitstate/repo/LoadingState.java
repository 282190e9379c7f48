package io.github.jbellis.gitstate.repo;

import java.util.concurrent.CompletableFuture;

/** Checking whether the working directory holds a repository, or creating one there. */
final class LoadingState extends DeferredState {
    LoadingState(Repository repository, CompletableFuture<Void> loadPromise) {
        super(repository, loadPromise);
    }

    @Override
    public String name() {
        return "Loading";
    }
}
