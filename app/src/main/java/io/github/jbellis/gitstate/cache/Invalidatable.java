package io.github.jbellis.gitstate.cache;

/** Something {@link Cache#invalidate} accepts: one exact key, or a group of keys. */
public sealed interface Invalidatable permits CacheKey, CacheGroup {}
