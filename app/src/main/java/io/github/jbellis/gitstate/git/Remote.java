package io.github.jbellis.gitstate.git;

/** A configured remote and its fetch URL. */
public record Remote(String name, String url) {}
