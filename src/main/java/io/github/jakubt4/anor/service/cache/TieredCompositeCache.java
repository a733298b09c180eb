package io.github.jakubt4.anor.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.jakubt4.anor.config.CacheProperties;
import io.github.jakubt4.anor.model.CacheKey;
import io.github.jakubt4.anor.model.CompositeImage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Bounded in-memory tier in front of {@link FitsCompositeStore}. Reads check memory first
 * and promote disk hits; writes go to disk first so memory never holds an entry the disk
 * tier failed to persist.
 *
 * <p>Memory entries keep the disk creation time, so {@code anor.cache.max-age} is measured
 * from the original write in both tiers.
 */
@Slf4j
@Primary
@Component
public class TieredCompositeCache implements CompositeCache {

    private final FitsCompositeStore store;
    private final CacheProperties cacheProperties;
    private final Clock clock;
    private final Cache<CacheKey, StoredComposite> memory;

    @Autowired
    public TieredCompositeCache(final FitsCompositeStore store, final CacheProperties cacheProperties) {
        this(store, cacheProperties, Clock.systemUTC());
    }

    TieredCompositeCache(final FitsCompositeStore store, final CacheProperties cacheProperties, final Clock clock) {
        this.store = store;
        this.cacheProperties = cacheProperties;
        this.clock = clock;
        this.memory = Caffeine.newBuilder()
                .maximumSize(Math.max(0, cacheProperties.getMemoryEntries()))
                .build();
    }

    @Override
    public Optional<CompositeImage> get(final CacheKey key) {
        final var cached = memory.getIfPresent(key);
        if (cached != null) {
            if (!FitsCompositeStore.isExpired(cached.createdAt(), cacheProperties.getMaxAge(), clock)) {
                log.debug("[CACHE] Memory hit {}", key);
                return Optional.of(cached.composite());
            }
            log.debug("[CACHE] {} expired in memory (created {})", key, cached.createdAt());
            memory.invalidate(key);
        }
        final var stored = store.getEntry(key);
        stored.ifPresent(entry -> {
            log.debug("[CACHE] Disk hit {}", key);
            memory.put(key, entry);
        });
        return stored.map(StoredComposite::composite);
    }

    @Override
    public void put(final CacheKey key, final CompositeImage composite) {
        memory.invalidate(key);
        final var createdAt = store.write(key, composite);
        memory.put(key, new StoredComposite(composite, createdAt));
    }

    @Override
    public void invalidate(final CacheKey key) {
        memory.invalidate(key);
        store.invalidate(key);
    }

    @Override
    public void clear() {
        memory.invalidateAll();
        store.clear();
    }
}
