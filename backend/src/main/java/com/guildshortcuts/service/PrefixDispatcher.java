package com.guildshortcuts.service;

import com.guildshortcuts.cache.ConfigCache;
import com.guildshortcuts.cache.SettingsKey;
import com.guildshortcuts.model.dto.DispatchReply;
import com.guildshortcuts.model.dto.InboundMessage;
import com.guildshortcuts.model.entity.GuildSettings;
import com.guildshortcuts.model.entity.ShortcutEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Scans every inbound guild message for "prefix + shortcut name" and answers
 * with the stored value of the first matching shortcut.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PrefixDispatcher {

    private final ShortcutStore shortcutStore;
    private final ConfigCache<SettingsKey, GuildSettings> settingsCache;

    public Optional<DispatchReply> dispatch(InboundMessage message) {
        if (message.getGuildId() == null || message.isAuthorBot() || message.getContent() == null) {
            return Optional.empty();
        }

        GuildSettings settings = settingsCache.queryOne(new SettingsKey(message.getGuildId())).orElse(null);
        if (settings == null) {
            return Optional.empty();
        }

        String content = message.getContent();
        String prefix = settings.getPrefix();
        if (content.length() < prefix.length() || !content.startsWith(prefix)) {
            return Optional.empty();
        }

        // Always read the full list fresh, shortcuts are never served from the cache here
        List<ShortcutEntry> shortcuts = shortcutStore.findAll(message.getGuildId());
        String invoked = content.substring(prefix.length());

        for (ShortcutEntry shortcut : shortcuts) {
            if (invoked.equalsIgnoreCase(shortcut.getName())) {
                log.debug("Guild {} matched shortcut {}", message.getGuildId(), shortcut.getName());
                return Optional.of(DispatchReply.builder()
                        .channelId(message.getChannelId())
                        .reply(shortcut.getValue())
                        .build());
            }
        }
        return Optional.empty();
    }
}
