package com.guildshortcuts.service.csv;

import com.guildshortcuts.cache.ConfigCache;
import com.guildshortcuts.cache.SettingsKey;
import com.guildshortcuts.model.entity.GuildSettings;
import com.guildshortcuts.model.entity.ShortcutEntry;
import com.guildshortcuts.service.ShortcutStore;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class CsvExportService {

    static final String[] HEADER = {"Shortcut", "Value", "Category"};

    private final ShortcutStore shortcutStore;
    private final ConfigCache<SettingsKey, GuildSettings> settingsCache;
    private final Clock clock;

    /**
     * Writes every shortcut of the guild as {@code prefix+name, value, category},
     * quoting only the cells that need it.
     */
    public String export(long guildId) {
        String prefix = settingsCache.queryOne(new SettingsKey(guildId))
                .map(GuildSettings::getPrefix)
                .orElse("");
        List<ShortcutEntry> entries = shortcutStore.findAll(guildId);

        StringWriter out = new StringWriter();
        try (CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(HEADER, false);
            for (ShortcutEntry entry : entries) {
                writer.writeNext(new String[]{
                        prefix + entry.getName(),
                        entry.getValue(),
                        entry.getCategory() != null ? entry.getCategory() : ShortcutEntry.DEFAULT_CATEGORY
                }, false);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write shortcut CSV", e);
        }

        log.info("Exported {} shortcuts for guild {}", entries.size(), guildId);
        return out.toString();
    }

    public String fileName(long guildId) {
        return "shortcuts-" + guildId + "-" + LocalDate.now(clock) + ".csv";
    }
}
