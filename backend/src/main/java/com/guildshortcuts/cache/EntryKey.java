package com.guildshortcuts.cache;

import java.util.Locale;

/**
 * Key of a single shortcut. Names are unique per guild regardless of case, so the
 * name is folded to lower case on construction.
 */
public record EntryKey(long guildId, String name) implements GuildScopedKey {

    public EntryKey {
        name = name == null ? null : name.toLowerCase(Locale.ROOT);
    }

    public static EntryKey of(long guildId, String name) {
        return new EntryKey(guildId, name);
    }
}
