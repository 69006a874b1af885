package com.guildshortcuts.controller;

import com.guildshortcuts.model.dto.GuildSettingsResponse;
import com.guildshortcuts.model.dto.PageSizeRequest;
import com.guildshortcuts.model.dto.PrefixRequest;
import com.guildshortcuts.service.ShortcutService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/guilds/{guildId}/settings")
@RequiredArgsConstructor
public class GuildSettingsController {

    private final ShortcutService shortcutService;

    @GetMapping
    public ResponseEntity<GuildSettingsResponse> get(@PathVariable long guildId) {
        return ResponseEntity.ok(shortcutService.getSettings(guildId));
    }

    @PutMapping("/prefix")
    public ResponseEntity<GuildSettingsResponse> setPrefix(@PathVariable long guildId,
                                                           @Valid @RequestBody PrefixRequest request) {
        return ResponseEntity.ok(shortcutService.setPrefix(guildId, request.getPrefix()));
    }

    @PutMapping("/page-size")
    public ResponseEntity<GuildSettingsResponse> setPageSize(@PathVariable long guildId,
                                                             @Valid @RequestBody PageSizeRequest request) {
        return ResponseEntity.ok(shortcutService.setPageSize(guildId, request.getPageSize()));
    }
}
