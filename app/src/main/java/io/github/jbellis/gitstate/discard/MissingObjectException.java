package io.github.jbellis.gitstate.discard;

import java.io.IOException;

/** A blob id that the content store cannot resolve. */
public class MissingObjectException extends IOException {
    private final String id;

    public MissingObjectException(String id, Throwable cause) {
        super("No object " + id, cause);
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
