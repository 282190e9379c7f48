package io.github.jbellis.gitstate.repo;

import java.util.concurrent.CompletableFuture;

/**
 * Placeholder while the caller is still working out which repository to show. It has no working directory and never
 * finishes loading on its own; calls made against it wait until the instance is destroyed and then fail.
 */
final class LoadingGuessState extends DeferredState {
    LoadingGuessState(Repository repository, CompletableFuture<Void> loadPromise) {
        super(repository, loadPromise);
    }

    @Override
    public String name() {
        return "LoadingGuess";
    }
}
