package com.guildshortcuts.controller;

import com.guildshortcuts.model.dto.CategorySelectRequest;
import com.guildshortcuts.service.browser.BrowserView;
import com.guildshortcuts.service.browser.CategoryBrowser;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/guilds/{guildId}/browser")
@RequiredArgsConstructor
public class BrowserController {

    private final CategoryBrowser categoryBrowser;

    @PostMapping
    public ResponseEntity<BrowserView> open(@PathVariable long guildId) {
        return ResponseEntity.ok(categoryBrowser.open(guildId));
    }

    @PostMapping("/{sessionId}/select")
    public ResponseEntity<BrowserView> select(@PathVariable long guildId, @PathVariable String sessionId,
                                              @Valid @RequestBody CategorySelectRequest request) {
        return ResponseEntity.ok(categoryBrowser.select(sessionId, guildId, request.getCategory()));
    }

    @PostMapping("/{sessionId}/next")
    public ResponseEntity<BrowserView> next(@PathVariable long guildId, @PathVariable String sessionId) {
        return ResponseEntity.ok(categoryBrowser.next(sessionId, guildId));
    }

    @PostMapping("/{sessionId}/previous")
    public ResponseEntity<BrowserView> previous(@PathVariable long guildId, @PathVariable String sessionId) {
        return ResponseEntity.ok(categoryBrowser.previous(sessionId, guildId));
    }

    @PostMapping("/{sessionId}/back")
    public ResponseEntity<BrowserView> back(@PathVariable long guildId, @PathVariable String sessionId) {
        return ResponseEntity.ok(categoryBrowser.back(sessionId, guildId));
    }
}
