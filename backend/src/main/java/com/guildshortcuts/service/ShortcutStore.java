package com.guildshortcuts.service;

import com.guildshortcuts.exception.ConflictException;
import com.guildshortcuts.exception.NotFoundException;
import com.guildshortcuts.model.dto.CategoryCount;
import com.guildshortcuts.model.dto.RemoveResult;
import com.guildshortcuts.model.entity.GuildSettings;
import com.guildshortcuts.model.entity.ShortcutEntry;
import com.guildshortcuts.repository.GuildSettingsRepository;
import com.guildshortcuts.repository.ShortcutEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Durable CRUD over guild settings and shortcut entries. Knows nothing about
 * caching: callers invalidate the affected cache keys once a call here returns.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShortcutStore {

    private final GuildSettingsRepository settingsRepository;
    private final ShortcutEntryRepository entryRepository;
    private final ShortcutValidator validator;

    public Optional<GuildSettings> findSettings(long guildId) {
        return settingsRepository.findById(guildId);
    }

    @Transactional
    public GuildSettings setPrefix(long guildId, String prefix) {
        validator.validatePrefix(prefix);

        GuildSettings settings = settingsRepository.findById(guildId)
                .orElse(GuildSettings.builder()
                        .guildId(guildId)
                        .build());
        settings.setPrefix(prefix);
        settings = settingsRepository.save(settings);

        log.info("Guild {} shortcut prefix set", guildId);
        return settings;
    }

    @Transactional
    public GuildSettings setPageSize(long guildId, Integer pageSize) {
        validator.validatePageSize(pageSize);

        GuildSettings settings = settingsRepository.findById(guildId)
                .orElseThrow(() -> new NotFoundException(
                        "This server has no shortcut configuration, set a prefix."));
        settings.setPageSize(pageSize);
        return settingsRepository.save(settings);
    }

    public Optional<ShortcutEntry> find(long guildId, String name) {
        return entryRepository.findByGuildIdAndNameIgnoreCase(guildId, name);
    }

    /**
     * All entries of a guild in creation order. Never cached.
     */
    public List<ShortcutEntry> findAll(long guildId) {
        return entryRepository.findByGuildIdOrderByCreatedAtAsc(guildId);
    }

    public List<String> findNames(long guildId) {
        return entryRepository.findNamesByGuildId(guildId);
    }

    public long count(long guildId) {
        return entryRepository.countByGuildId(guildId);
    }

    @Transactional
    public ShortcutEntry set(long guildId, String name, String value, String category) {
        validator.validateName(name);
        validator.validateValue(value);
        String normalizedCategory = validator.normalizeCategory(category);

        ShortcutEntry entry = entryRepository.findByGuildIdAndNameIgnoreCase(guildId, name)
                .orElse(ShortcutEntry.builder()
                        .guildId(guildId)
                        .name(name)
                        .build());
        entry.setValue(value);
        entry.setCategory(normalizedCategory);

        return entryRepository.save(entry);
    }

    @Transactional
    public RemoveResult remove(long guildId, String name) {
        Optional<ShortcutEntry> entry = entryRepository.findByGuildIdAndNameIgnoreCase(guildId, name);
        if (entry.isEmpty()) {
            return RemoveResult.NOT_FOUND;
        }
        entryRepository.delete(entry.get());
        return RemoveResult.REMOVED;
    }

    /**
     * Creates the destination row, then deletes the source, within one transaction.
     * A rename that only changes the letter case of the name is allowed.
     */
    @Transactional
    public ShortcutEntry rename(long guildId, String oldName, String newName) {
        validator.validateName(newName);

        ShortcutEntry source = entryRepository.findByGuildIdAndNameIgnoreCase(guildId, oldName)
                .orElseThrow(() -> new NotFoundException("No shortcut named " + oldName + " found!"));

        if (source.getName().equals(newName)) {
            return source;
        }

        Optional<ShortcutEntry> existing = entryRepository.findByGuildIdAndNameIgnoreCase(guildId, newName);
        if (existing.isPresent() && !existing.get().getName().equals(source.getName())) {
            throw new ConflictException("A shortcut named " + newName + " already exists");
        }

        ShortcutEntry renamed = entryRepository.save(ShortcutEntry.builder()
                .guildId(guildId)
                .name(newName)
                .value(source.getValue())
                .category(source.getCategory())
                .build());
        entryRepository.delete(source);

        return renamed;
    }

    @Transactional
    public ShortcutEntry move(long guildId, String name, String category) {
        String normalizedCategory = validator.normalizeCategory(category);

        ShortcutEntry entry = entryRepository.findByGuildIdAndNameIgnoreCase(guildId, name)
                .orElseThrow(() -> new NotFoundException("No shortcut named " + name + " found!"));
        entry.setCategory(normalizedCategory);
        return entryRepository.save(entry);
    }

    /**
     * Category counts computed from the full table, sorted by category name.
     */
    public List<CategoryCount> countByCategory(long guildId) {
        return entryRepository.countGroupedByCategory(guildId)
                .stream()
                .map(row -> CategoryCount.builder()
                        .category((String) row[0])
                        .count((Long) row[1])
                        .build())
                .toList();
    }

    public long countInCategory(long guildId, String category) {
        return entryRepository.countByGuildIdAndCategory(guildId, category);
    }

    public Page<ShortcutEntry> findPage(long guildId, String category, int page, int pageSize) {
        return entryRepository.findByGuildIdAndCategory(guildId, category,
                PageRequest.of(page, pageSize, Sort.by("name")));
    }

    @Transactional
    public int reassignCategory(long guildId, String category) {
        return entryRepository.reassignCategory(guildId, category, ShortcutEntry.DEFAULT_CATEGORY);
    }

    @Transactional
    public int deleteByCategory(long guildId, String category) {
        return entryRepository.deleteByGuildIdAndCategory(guildId, category);
    }

    @Transactional
    public int deleteAll(long guildId) {
        return entryRepository.deleteAllByGuildId(guildId);
    }
}
