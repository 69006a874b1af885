package com.guildshortcuts.service;

import com.guildshortcuts.cache.ConfigCache;
import com.guildshortcuts.cache.EntryKey;
import com.guildshortcuts.cache.SettingsKey;
import com.guildshortcuts.exception.NotFoundException;
import com.guildshortcuts.exception.ValidationException;
import com.guildshortcuts.model.dto.*;
import com.guildshortcuts.model.entity.GuildSettings;
import com.guildshortcuts.model.entity.ShortcutEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Guild-scoped shortcut commands. Reads go through the config caches; every
 * write is applied to the store first and the affected cache keys are dropped
 * afterwards.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShortcutService {

    public static final String CONFIRM_TOKEN = "CONFIRM";
    public static final String ALL_TARGET = "all";

    private final ShortcutStore shortcutStore;
    private final ConfigCache<SettingsKey, GuildSettings> settingsCache;
    private final ConfigCache<EntryKey, ShortcutEntry> entryCache;

    public GuildSettingsResponse getSettings(long guildId) {
        return toResponse(requireSettings(guildId));
    }

    public GuildSettingsResponse setPrefix(long guildId, String prefix) {
        GuildSettings settings = shortcutStore.setPrefix(guildId, prefix);
        settingsCache.invalidateEntry(new SettingsKey(guildId));
        return toResponse(settings);
    }

    public GuildSettingsResponse setPageSize(long guildId, Integer pageSize) {
        GuildSettings settings = shortcutStore.setPageSize(guildId, pageSize);
        settingsCache.invalidateEntry(new SettingsKey(guildId));
        log.info("Guild {} browser page size set to {}", guildId, pageSize);
        return toResponse(settings);
    }

    public ShortcutDto get(long guildId, String name) {
        ShortcutEntry entry = entryCache.queryOne(EntryKey.of(guildId, name))
                .orElseThrow(() -> missingShortcut(guildId, name));
        return toDto(entry, prefixOf(guildId));
    }

    public ShortcutDto set(long guildId, String name, String value, String category) {
        GuildSettings settings = settingsCache.queryOne(new SettingsKey(guildId))
                .orElseThrow(() -> new ValidationException("Set a prefix first!"));

        ShortcutEntry entry = shortcutStore.set(guildId, name, value, category);
        entryCache.invalidateEntry(EntryKey.of(guildId, name));

        log.info("Guild {} shortcut {} updated in category {}", guildId, entry.getName(), entry.getCategory());
        return toDto(entry, settings.getPrefix());
    }

    public RemoveResponse remove(long guildId, String name) {
        RemoveResult result = shortcutStore.remove(guildId, name);
        entryCache.invalidateEntry(EntryKey.of(guildId, name));

        if (result == RemoveResult.NOT_FOUND) {
            return RemoveResponse.builder()
                    .name(name)
                    .removed(false)
                    .message("No command named " + name + " found!")
                    .build();
        }

        log.info("Guild {} shortcut {} removed", guildId, name);
        return RemoveResponse.builder()
                .name(name)
                .removed(true)
                .message("Removed command " + name + " successfully.")
                .build();
    }

    public ShortcutDto rename(long guildId, String oldName, String newName) {
        requireEntry(guildId, oldName);

        ShortcutEntry renamed = shortcutStore.rename(guildId, oldName, newName);
        entryCache.invalidateEntry(EntryKey.of(guildId, oldName));
        entryCache.invalidateEntry(EntryKey.of(guildId, newName));

        log.info("Guild {} shortcut {} renamed to {}", guildId, oldName, newName);
        return toDto(renamed, prefixOf(guildId));
    }

    public ShortcutDto move(long guildId, String name, String category) {
        requireEntry(guildId, name);

        ShortcutEntry moved = shortcutStore.move(guildId, name, category);
        entryCache.invalidateEntry(EntryKey.of(guildId, name));

        log.info("Guild {} shortcut {} moved to {}", guildId, name, moved.getCategory());
        return toDto(moved, prefixOf(guildId));
    }

    public List<CategoryCount> categories(long guildId) {
        return shortcutStore.countByCategory(guildId);
    }

    /**
     * Drops a category tag by moving its entries back to "General".
     */
    public CategoryDeleteResponse deleteCategory(long guildId, String category) {
        if (ShortcutEntry.DEFAULT_CATEGORY.equals(category)) {
            throw new ValidationException("The " + ShortcutEntry.DEFAULT_CATEGORY + " category cannot be deleted");
        }
        if (shortcutStore.countInCategory(guildId, category) == 0) {
            throw missingCategory(guildId, category);
        }

        int reassigned = shortcutStore.reassignCategory(guildId, category);
        entryCache.invalidateByGuild(guildId);

        log.info("Guild {} category {} deleted, {} shortcuts moved to {}",
                guildId, category, reassigned, ShortcutEntry.DEFAULT_CATEGORY);
        return CategoryDeleteResponse.builder()
                .category(category)
                .reassigned(reassigned)
                .message("Moved " + reassigned + " shortcuts from " + category
                        + " to " + ShortcutEntry.DEFAULT_CATEGORY + ".")
                .build();
    }

    /**
     * Deletes every shortcut of a category, or of the whole guild for the target
     * "all". Nothing is deleted unless {@code confirm} is the literal "CONFIRM".
     */
    public BulkDeleteResponse bulkDelete(long guildId, String target, String confirm) {
        boolean all = ALL_TARGET.equalsIgnoreCase(target);
        long matched = all
                ? shortcutStore.count(guildId)
                : shortcutStore.countInCategory(guildId, target);

        if (!all && matched == 0) {
            throw missingCategory(guildId, target);
        }

        String scope = all ? "all shortcuts" : "all shortcuts in category " + target;
        if (!CONFIRM_TOKEN.equals(confirm)) {
            return BulkDeleteResponse.builder()
                    .target(target)
                    .confirmed(false)
                    .matched(matched)
                    .deleted(0)
                    .message("This will delete " + scope + " (" + matched + "). Repeat with "
                            + CONFIRM_TOKEN + " to proceed.")
                    .build();
        }

        int deleted = all
                ? shortcutStore.deleteAll(guildId)
                : shortcutStore.deleteByCategory(guildId, target);
        entryCache.invalidateByGuild(guildId);

        log.info("Guild {} bulk delete of {} removed {} shortcuts", guildId, scope, deleted);
        return BulkDeleteResponse.builder()
                .target(target)
                .confirmed(true)
                .matched(matched)
                .deleted(deleted)
                .message("Deleted " + deleted + " shortcuts.")
                .build();
    }

    private GuildSettings requireSettings(long guildId) {
        return settingsCache.queryOne(new SettingsKey(guildId))
                .orElseThrow(() -> new NotFoundException(
                        "This server has no shortcut configuration, set a prefix."));
    }

    private ShortcutEntry requireEntry(long guildId, String name) {
        return entryCache.queryOne(EntryKey.of(guildId, name))
                .orElseThrow(() -> missingShortcut(guildId, name));
    }

    private String prefixOf(long guildId) {
        return settingsCache.queryOne(new SettingsKey(guildId))
                .map(GuildSettings::getPrefix)
                .orElse("");
    }

    private NotFoundException missingShortcut(long guildId, String name) {
        return new NotFoundException("No shortcut named " + name + " found! "
                + Hints.knownItems("shortcuts", shortcutStore.findNames(guildId)));
    }

    private NotFoundException missingCategory(long guildId, String category) {
        List<String> known = shortcutStore.countByCategory(guildId).stream()
                .map(CategoryCount::getCategory)
                .toList();
        return new NotFoundException("No category named " + category + " found! "
                + Hints.knownItems("categories", known));
    }

    private GuildSettingsResponse toResponse(GuildSettings settings) {
        return GuildSettingsResponse.builder()
                .guildId(settings.getGuildId())
                .prefix(settings.getPrefix())
                .pageSize(settings.getPageSize())
                .updatedAt(settings.getUpdatedAt())
                .build();
    }

    private ShortcutDto toDto(ShortcutEntry entry, String prefix) {
        return ShortcutDto.builder()
                .name(entry.getName())
                .trigger(prefix + entry.getName())
                .value(entry.getValue())
                .category(entry.getCategory())
                .createdAt(entry.getCreatedAt())
                .build();
    }
}
