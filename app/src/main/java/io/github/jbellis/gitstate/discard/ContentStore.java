package io.github.jbellis.gitstate.discard;

import java.io.IOException;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * What discard history needs from the backing store: a content-addressed blob layer, the working files, and local
 * key/value metadata.
 */
public interface ContentStore {
    /** Stores {@code content} and returns its content hash. Writing the same bytes twice yields the same hash. */
    String writeBlob(byte[] content) throws IOException;

    /** @throws MissingObjectException when {@code id} does not name a stored blob */
    byte[] readBlob(String id) throws IOException;

    Optional<byte[]> readWorkingFile(String path) throws IOException;

    /** Writes the file, or deletes it when {@code content} is null. */
    void writeWorkingFile(String path, byte @Nullable [] content) throws IOException;

    Optional<String> readMetadata(String key) throws IOException;

    void writeMetadata(String key, String value) throws IOException;
}
