package com.guildshortcuts.cache;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.function.Function;

/**
 * Read-through memo table in front of the shortcut store for one entity type.
 * <p>
 * Absent results are memoized as well and dropped by the next invalidation.
 * Concurrent misses on the same key may both reach the store; whichever load
 * finishes last is the one kept. Callers must invalidate only after their store
 * write has been applied.
 * <p>
 * Failures of the memo table itself are logged and never reach the caller:
 * reads fall back to the store, failed invalidations flush the whole table.
 */
@Slf4j
public class ConfigCache<K extends GuildScopedKey, V> {

    private final String name;
    private final Cache<K, Optional<V>> entries;
    private final Function<K, Optional<V>> loader;

    public ConfigCache(String name, Cache<K, Optional<V>> entries, Function<K, Optional<V>> loader) {
        this.name = name;
        this.entries = entries;
        this.loader = loader;
    }

    public Optional<V> queryOne(K key) {
        Optional<V> cached = lookup(key);
        if (cached != null) {
            return cached;
        }

        log.debug("{} cache miss for {}", name, key);
        Optional<V> loaded = loader.apply(key);
        try {
            entries.put(key, loaded);
        } catch (RuntimeException e) {
            log.warn("{} cache could not memoize {}", name, key, e);
        }
        return loaded;
    }

    public void invalidateEntry(K key) {
        try {
            entries.invalidate(key);
            log.debug("{} cache invalidated {}", name, key);
        } catch (RuntimeException e) {
            log.warn("{} cache failed to invalidate {}, flushing", name, key, e);
            flush();
        }
    }

    public void invalidateByGuild(long guildId) {
        try {
            entries.asMap().keySet().removeIf(key -> key.guildId() == guildId);
            log.debug("{} cache invalidated guild {}", name, guildId);
        } catch (RuntimeException e) {
            log.warn("{} cache failed to invalidate guild {}, flushing", name, guildId, e);
            flush();
        }
    }

    public long size() {
        return entries.estimatedSize();
    }

    private Optional<V> lookup(K key) {
        try {
            return entries.getIfPresent(key);
        } catch (RuntimeException e) {
            log.warn("{} cache lookup failed for {}, reading store", name, key, e);
            return null;
        }
    }

    private void flush() {
        try {
            entries.invalidateAll();
        } catch (RuntimeException e) {
            log.error("{} cache could not be flushed", name, e);
        }
    }
}
