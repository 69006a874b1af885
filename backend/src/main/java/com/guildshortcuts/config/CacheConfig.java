package com.guildshortcuts.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.guildshortcuts.cache.ConfigCache;
import com.guildshortcuts.cache.EntryKey;
import com.guildshortcuts.cache.SettingsKey;
import com.guildshortcuts.model.entity.GuildSettings;
import com.guildshortcuts.model.entity.ShortcutEntry;
import com.guildshortcuts.service.ShortcutStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

@Configuration
public class CacheConfig {

    @Value("${app.shortcuts.cache.maximum-size:10000}")
    private long maximumSize;

    @Value("${app.shortcuts.cache.expire-after-write-minutes:30}")
    private long expireAfterWriteMinutes;

    @Bean
    public ConfigCache<SettingsKey, GuildSettings> settingsCache(ShortcutStore shortcutStore) {
        Cache<SettingsKey, Optional<GuildSettings>> entries = memoTable();
        return new ConfigCache<>("settings", entries, key -> shortcutStore.findSettings(key.guildId()));
    }

    @Bean
    public ConfigCache<EntryKey, ShortcutEntry> entryCache(ShortcutStore shortcutStore) {
        Cache<EntryKey, Optional<ShortcutEntry>> entries = memoTable();
        return new ConfigCache<>("shortcuts", entries, key -> shortcutStore.find(key.guildId(), key.name()));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private <K, V> Cache<K, Optional<V>> memoTable() {
        return Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(expireAfterWriteMinutes, TimeUnit.MINUTES)
                .build();
    }
}
