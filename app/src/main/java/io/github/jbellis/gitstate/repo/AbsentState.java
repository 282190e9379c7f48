package io.github.jbellis.gitstate.repo;

import io.github.jbellis.gitstate.git.GitRepoFactory;
import java.util.concurrent.CompletableFuture;

/**
 * The working directory holds no repository. Content operations fail; {@link #init()} and {@link #clone(String)}
 * create one, which takes the instance through {@code Loading} to {@code Present}.
 */
final class AbsentState extends UnavailableState {
    AbsentState(Repository repository) {
        super(repository);
    }

    @Override
    public String name() {
        return "Absent";
    }

    @Override
    public boolean isAbsent() {
        return true;
    }

    @Override
    public boolean isEmpty() {
        return true;
    }

    @Override
    public boolean showGitTabInit() {
        return true;
    }

    @Override
    public CompletableFuture<Void> init() {
        var dir = repository.getWorkingDirectoryPath();
        if (dir == null) {
            return notReady("init");
        }
        var settings = repository.getSettings();
        return repository.load(() -> GitRepoFactory.initRepo(dir, settings));
    }

    @Override
    public CompletableFuture<Void> clone(String url) {
        var dir = repository.getWorkingDirectoryPath();
        if (dir == null) {
            return notReady("clone");
        }
        var settings = repository.getSettings();
        return repository.load(() -> GitRepoFactory.cloneRepo(url, dir, settings));
    }
}
