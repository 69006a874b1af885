package com.guildshortcuts.cache;

/**
 * Cache key made of the unique fields of an entity, always led by the guild.
 */
public interface GuildScopedKey {
    long guildId();
}
