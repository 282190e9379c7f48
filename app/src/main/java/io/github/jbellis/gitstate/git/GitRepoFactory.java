package io.github.jbellis.gitstate.git;

import io.github.jbellis.gitstate.util.GitStateSettings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.errors.RepositoryNotFoundException;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;

public class GitRepoFactory {
    private static final Logger logger = LogManager.getLogger(GitRepoFactory.class);

    private GitRepoFactory() {}

    /** Returns true if {@code dir} holds its own readable {@code .git} directory. */
    public static boolean hasGitRepo(Path dir) {
        if (!Files.isDirectory(dir.resolve(".git"))) {
            return false;
        }
        try (var repo = new FileRepositoryBuilder()
                .setGitDir(dir.resolve(".git").toFile())
                .setMustExist(true)
                .build()) {
            return repo.getObjectDatabase().exists();
        } catch (RepositoryNotFoundException e) {
            return false;
        } catch (IOException e) {
            // Corrupted or unreadable repo -> treat as non-git
            logger.warn("Could not read git repo at {}: {}", dir, e.getMessage());
            return false;
        }
    }

    /** Initializes an empty repository (no commits) in {@code root}, creating the directory if needed. */
    public static GitRepo initRepo(Path root, GitStateSettings settings) throws GitAPIException {
        logger.info("Initializing new Git repository at {}", root);
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new GitRepo.GitWrappedIOException("git init " + root, e);
        }
        try (var ignored = Git.init().setDirectory(root.toFile()).call()) {
            logger.debug("Git repository initialized at {}", root);
        }
        return new GitRepo(root, settings);
    }

    /**
     * Clones {@code remoteUrl} into {@code directory}, which must be empty or not yet exist.
     */
    public static GitRepo cloneRepo(String remoteUrl, Path directory, GitStateSettings settings)
            throws GitAPIException {
        if (!isEmptyOrMissing(directory)) {
            throw new CommandFailure(
                    "git clone " + remoteUrl + " " + directory,
                    128,
                    "fatal: destination path '" + directory + "' already exists and is not an empty directory.");
        }

        try {
            var cloneCmd = Git.cloneRepository()
                    .setURI(remoteUrl)
                    .setDirectory(directory.toFile())
                    .setTimeout((int) settings.networkTimeout().toSeconds());
            // Perform clone and immediately close the returned Git handle
            try (var ignored = cloneCmd.call()) {
                // closed via try-with-resources
            }
            return new GitRepo(directory, settings);
        } catch (GitAPIException e) {
            logger.error("Failed to clone {} into {}: {}", remoteUrl, directory, e.getMessage(), e);
            throw GitRepo.asFailure("git clone " + remoteUrl + " " + directory, e);
        }
    }

    private static boolean isEmptyOrMissing(Path directory) {
        if (!Files.exists(directory)) {
            return true;
        }
        try (Stream<Path> children = Files.list(directory)) {
            return children.findAny().isEmpty();
        } catch (IOException e) {
            return false;
        }
    }
}
