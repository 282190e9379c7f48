package io.github.jbellis.gitstate.repo;

import io.github.jbellis.gitstate.discard.ContentStore;
import io.github.jbellis.gitstate.discard.MissingObjectException;
import io.github.jbellis.gitstate.git.CommandFailure;
import io.github.jbellis.gitstate.git.IGitRepo;
import java.io.IOException;
import java.util.Optional;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.jetbrains.annotations.Nullable;

/** Discard history storage on top of the git object database and the repository's local config. */
class GitContentStore implements ContentStore {
    private final IGitRepo git;

    GitContentStore(IGitRepo git) {
        this.git = git;
    }

    @Override
    public String writeBlob(byte[] content) throws IOException {
        try {
            return git.writeObject(content);
        } catch (GitAPIException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    @Override
    public byte[] readBlob(String id) throws IOException {
        try {
            return git.readObject(id);
        } catch (CommandFailure e) {
            if (e.getExitCode() == 128 && e.getStderr().contains("Not a valid object name")) {
                throw new MissingObjectException(id, e);
            }
            throw new IOException(e.getMessage(), e);
        } catch (GitAPIException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    @Override
    public Optional<byte[]> readWorkingFile(String path) throws IOException {
        try {
            return git.readWorkingTreeContent(path);
        } catch (GitAPIException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    @Override
    public void writeWorkingFile(String path, byte @Nullable [] content) throws IOException {
        try {
            git.writeWorkingTreeFile(path, content);
        } catch (GitAPIException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> readMetadata(String key) throws IOException {
        try {
            return git.getConfig(key, true);
        } catch (GitAPIException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    @Override
    public void writeMetadata(String key, String value) throws IOException {
        try {
            git.setConfig(key, value);
        } catch (GitAPIException e) {
            throw new IOException(e.getMessage(), e);
        }
    }
}
