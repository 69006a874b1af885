package com.guildshortcuts.controller;

import com.guildshortcuts.exception.CsvImportException;
import com.guildshortcuts.model.dto.ImportReport;
import com.guildshortcuts.service.csv.CsvExportService;
import com.guildshortcuts.service.csv.CsvImportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Slf4j
@RestController
@RequestMapping("/api/guilds/{guildId}/shortcuts")
@RequiredArgsConstructor
public class CsvController {

    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    @Value("${app.import.max-file-size:1048576}")
    private long maxFileSize;

    private final CsvExportService csvExportService;
    private final CsvImportService csvImportService;

    @GetMapping("/export")
    public ResponseEntity<byte[]> export(@PathVariable long guildId) {
        byte[] body = csvExportService.export(guildId).getBytes(StandardCharsets.UTF_8);
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(csvExportService.fileName(guildId))
                        .build()
                        .toString())
                .body(body);
    }

    @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImportReport> importCsv(@PathVariable long guildId,
                                                  @RequestParam("file") MultipartFile file) {
        if (file.isEmpty()) {
            throw new CsvImportException("No file attached");
        }
        if (file.getSize() > maxFileSize) {
            throw new CsvImportException("File exceeds the maximum size of " + maxFileSize + " bytes");
        }

        log.info("Importing shortcuts for guild {} from {} ({} bytes)",
                guildId, file.getOriginalFilename(), file.getSize());
        try {
            return ResponseEntity.ok(csvImportService.importCsv(guildId, file.getBytes()));
        } catch (IOException e) {
            throw new CsvImportException("Could not read uploaded file", e);
        }
    }
}
