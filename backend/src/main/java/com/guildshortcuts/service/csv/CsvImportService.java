package com.guildshortcuts.service.csv;

import com.guildshortcuts.cache.ConfigCache;
import com.guildshortcuts.cache.EntryKey;
import com.guildshortcuts.cache.SettingsKey;
import com.guildshortcuts.exception.CsvImportException;
import com.guildshortcuts.exception.ValidationException;
import com.guildshortcuts.model.dto.ImportReport;
import com.guildshortcuts.model.entity.GuildSettings;
import com.guildshortcuts.model.entity.ShortcutEntry;
import com.guildshortcuts.service.ShortcutStore;
import com.opencsv.ICSVParser;
import com.opencsv.RFC4180ParserBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Bulk import of shortcuts from an uploaded CSV file.
 * <p>
 * Decoding errors, malformed CSV and a missing prefix reject the whole file
 * before any row is written. After that every row stands on its own: a row that
 * fails validation is reported and skipped, the rest of the file is still
 * imported. Rows are written one by one with no batch transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CsvImportService {

    static final int MAX_REPORTED_ERRORS = 10;

    private static final String SHORTCUT_HEADER = "shortcut";
    private static final String VALUE_HEADER = "value";
    private static final String CATEGORY_HEADER = "category";
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final ShortcutStore shortcutStore;
    private final ConfigCache<SettingsKey, GuildSettings> settingsCache;
    private final ConfigCache<EntryKey, ShortcutEntry> entryCache;

    public ImportReport importCsv(long guildId, byte[] data) {
        List<String[]> rows = parse(decode(data));
        if (rows.isEmpty()) {
            throw new CsvImportException("CSV file is empty");
        }

        ColumnLayout layout = ColumnLayout.detect(rows.get(0));

        String prefix = settingsCache.queryOne(new SettingsKey(guildId))
                .map(GuildSettings::getPrefix)
                .orElseThrow(() -> new CsvImportException("Set a prefix first!"));

        int imported = 0;
        List<String> errors = new ArrayList<>();

        for (int i = layout.header() ? 1 : 0; i < rows.size(); i++) {
            String[] row = rows.get(i);
            if (isBlank(row)) {
                continue;
            }

            String name = cell(row, layout.shortcut());
            if (name != null && name.startsWith(prefix)) {
                name = name.substring(prefix.length());
            }

            try {
                shortcutStore.set(guildId, name, cell(row, layout.value()), cell(row, layout.category()));
                entryCache.invalidateEntry(EntryKey.of(guildId, name));
                imported++;
            } catch (ValidationException e) {
                errors.add("row " + (i + 1) + ": " + e.getMessage());
            }
        }

        log.info("Guild {} CSV import finished: {} imported, {} skipped", guildId, imported, errors.size());
        return ImportReport.builder()
                .imported(imported)
                .skipped(errors.size())
                .headerDetected(layout.header())
                .errors(List.copyOf(errors.subList(0, Math.min(MAX_REPORTED_ERRORS, errors.size()))))
                .moreErrors(Math.max(0, errors.size() - MAX_REPORTED_ERRORS))
                .build();
    }

    private String decode(byte[] data) {
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data))
                    .toString();
            return !text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text;
        } catch (CharacterCodingException e) {
            throw new CsvImportException("File is not valid UTF-8 text", e);
        }
    }

    private List<String[]> parse(String text) {
        // RFC 4180 quoting, backslashes are plain characters as written by the export
        ICSVParser parser = new RFC4180ParserBuilder().build();
        List<String[]> rows = new ArrayList<>();
        try {
            for (String record : splitRecords(text)) {
                rows.add(parser.parseLine(record));
            }
        } catch (IOException e) {
            throw new CsvImportException("Malformed CSV file: " + e.getMessage(), e);
        }
        return rows;
    }

    /**
     * Splits on LF, CRLF or bare CR outside quotes. Line breaks inside a quoted
     * cell, carriage returns included, are kept for the parser.
     */
    static List<String> splitRecords(String text) {
        List<String> records = new ArrayList<>();
        StringBuilder record = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!quoted && (c == '\n' || c == '\r')) {
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                records.add(record.toString());
                record.setLength(0);
                continue;
            }
            if (c == '"') {
                quoted = !quoted;
            }
            record.append(c);
        }
        if (quoted) {
            throw new CsvImportException(
                    "Malformed CSV file: unterminated quoted field on row " + (records.size() + 1));
        }
        if (record.length() > 0) {
            records.add(record.toString());
        }
        return records;
    }

    private static String cell(String[] row, int index) {
        return index >= 0 && index < row.length ? row[index] : null;
    }

    private static boolean isBlank(String[] row) {
        for (String value : row) {
            if (value != null && !value.isBlank()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Column positions of one file. A first row whose first two cells read
     * "shortcut" and "value" (any case) is a header and columns are looked up by
     * name; otherwise the file is positional and the first row is data.
     */
    record ColumnLayout(boolean header, int shortcut, int value, int category) {

        static final ColumnLayout POSITIONAL = new ColumnLayout(false, 0, 1, 2);

        static ColumnLayout detect(String[] firstRow) {
            if (firstRow.length < 2
                    || !SHORTCUT_HEADER.equalsIgnoreCase(firstRow[0])
                    || !VALUE_HEADER.equalsIgnoreCase(firstRow[1])) {
                return POSITIONAL;
            }

            Map<String, Integer> columns = new HashMap<>();
            for (int i = 0; i < firstRow.length; i++) {
                columns.putIfAbsent(firstRow[i].trim().toLowerCase(Locale.ROOT), i);
            }
            return new ColumnLayout(true,
                    columns.get(SHORTCUT_HEADER),
                    columns.get(VALUE_HEADER),
                    columns.getOrDefault(CATEGORY_HEADER, -1));
        }
    }
}
