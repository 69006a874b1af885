package com.guildshortcuts.cache;

public record SettingsKey(long guildId) implements GuildScopedKey {
}
