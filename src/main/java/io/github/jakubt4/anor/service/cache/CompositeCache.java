package io.github.jakubt4.anor.service.cache;

import io.github.jakubt4.anor.model.CacheKey;
import io.github.jakubt4.anor.model.CompositeImage;

import java.util.Optional;

/**
 * Durable store of fused composites keyed by (source, band, day).
 */
public interface CompositeCache {

    /**
     * Never throws: missing, expired or unreadable entries are all reported as absent.
     */
    Optional<CompositeImage> get(CacheKey key);

    /**
     * Replaces any existing entry under {@code key} as a whole; concurrent writers race and
     * the last one wins.
     *
     * @throws CacheWriteException when the entry cannot be persisted
     */
    void put(CacheKey key, CompositeImage composite);

    void invalidate(CacheKey key);

    void clear();
}
