package com.guildshortcuts.controller;

import com.guildshortcuts.model.dto.*;
import com.guildshortcuts.service.ShortcutService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/guilds/{guildId}")
@RequiredArgsConstructor
public class ShortcutController {

    private final ShortcutService shortcutService;

    @GetMapping("/shortcuts/{name}")
    public ResponseEntity<ShortcutDto> get(@PathVariable long guildId, @PathVariable String name) {
        return ResponseEntity.ok(shortcutService.get(guildId, name));
    }

    @PutMapping("/shortcuts/{name}")
    public ResponseEntity<ShortcutDto> set(@PathVariable long guildId, @PathVariable String name,
                                           @RequestBody ShortcutRequest request) {
        return ResponseEntity.ok(
                shortcutService.set(guildId, name, request.getValue(), request.getCategory()));
    }

    @DeleteMapping("/shortcuts/{name}")
    public ResponseEntity<RemoveResponse> remove(@PathVariable long guildId, @PathVariable String name) {
        return ResponseEntity.ok(shortcutService.remove(guildId, name));
    }

    @PostMapping("/shortcuts/{name}/rename")
    public ResponseEntity<ShortcutDto> rename(@PathVariable long guildId, @PathVariable String name,
                                              @Valid @RequestBody RenameRequest request) {
        return ResponseEntity.ok(shortcutService.rename(guildId, name, request.getNewName()));
    }

    @PostMapping("/shortcuts/{name}/move")
    public ResponseEntity<ShortcutDto> move(@PathVariable long guildId, @PathVariable String name,
                                            @RequestBody MoveRequest request) {
        return ResponseEntity.ok(shortcutService.move(guildId, name, request.getCategory()));
    }

    @PostMapping("/shortcuts/bulk-delete")
    public ResponseEntity<BulkDeleteResponse> bulkDelete(@PathVariable long guildId,
                                                         @Valid @RequestBody BulkDeleteRequest request) {
        return ResponseEntity.ok(
                shortcutService.bulkDelete(guildId, request.getTarget(), request.getConfirm()));
    }

    @GetMapping("/categories")
    public ResponseEntity<List<CategoryCount>> categories(@PathVariable long guildId) {
        return ResponseEntity.ok(shortcutService.categories(guildId));
    }

    @DeleteMapping("/categories/{category}")
    public ResponseEntity<CategoryDeleteResponse> deleteCategory(@PathVariable long guildId,
                                                                 @PathVariable String category) {
        return ResponseEntity.ok(shortcutService.deleteCategory(guildId, category));
    }
}
