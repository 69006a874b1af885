package com.guildshortcuts.service.browser;

import com.guildshortcuts.model.dto.CategoryCount;
import com.guildshortcuts.model.entity.ShortcutEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of one browser session. Every interaction produces a new
 * value; the registry keeps only the latest one.
 */
@Value
@Builder(toBuilder = true)
public class BrowserState {
    String sessionId;
    long guildId;
    BrowserStage stage;
    String prefix;
    int pageSize;
    @Builder.Default
    List<CategoryCount> categories = List.of();
    String category;
    int page;
    int maxPages;
    @Builder.Default
    List<ShortcutEntry> entries = List.of();
    Instant lastInteraction;

    public boolean isFirstPage() {
        return page <= 0;
    }

    public boolean isLastPage() {
        return page >= maxPages - 1;
    }
}
