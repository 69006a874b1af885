package com.guildshortcuts.service.browser;

import com.guildshortcuts.cache.ConfigCache;
import com.guildshortcuts.cache.SettingsKey;
import com.guildshortcuts.exception.NotFoundException;
import com.guildshortcuts.exception.ValidationException;
import com.guildshortcuts.model.dto.CategoryCount;
import com.guildshortcuts.model.entity.GuildSettings;
import com.guildshortcuts.model.entity.ShortcutEntry;
import com.guildshortcuts.service.Hints;
import com.guildshortcuts.service.ShortcutStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Interactive category/page browsing. Category lists and pages are always read
 * straight from the store; only the guild settings come from the cache.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CategoryBrowser {

    private final ShortcutStore shortcutStore;
    private final ConfigCache<SettingsKey, GuildSettings> settingsCache;
    private final BrowserSessionRegistry registry;

    public BrowserView open(long guildId) {
        GuildSettings settings = settingsCache.queryOne(new SettingsKey(guildId)).orElse(null);

        BrowserState state = registry.save(BrowserState.builder()
                .sessionId(registry.newSessionId())
                .guildId(guildId)
                .stage(BrowserStage.CATEGORY_SELECT)
                .prefix(settings != null ? settings.getPrefix() : "")
                .pageSize(pageSizeOf(settings))
                .categories(shortcutStore.countByCategory(guildId))
                .lastInteraction(registry.now())
                .build());

        log.debug("Opened browser {} for guild {}", state.getSessionId(), guildId);
        return BrowserRenderer.render(state, null);
    }

    public BrowserView select(String sessionId, long guildId, String category) {
        BrowserState state = registry.claim(sessionId, guildId);
        requireStage(state, BrowserStage.CATEGORY_SELECT, "Go back to the category list first.");

        long count = shortcutStore.countInCategory(guildId, category);
        if (count == 0) {
            List<String> known = shortcutStore.countByCategory(guildId).stream()
                    .map(CategoryCount::getCategory)
                    .toList();
            throw new NotFoundException("No category named " + category + " found! "
                    + Hints.knownItems("categories", known));
        }

        int pageSize = settingsCache.queryOne(new SettingsKey(guildId))
                .map(this::pageSizeOf)
                .orElse(state.getPageSize());
        int maxPages = (int) ((count + pageSize - 1) / pageSize);

        BrowserState next = registry.save(state.toBuilder()
                .stage(BrowserStage.PAGED_LIST)
                .category(category)
                .pageSize(pageSize)
                .page(0)
                .maxPages(maxPages)
                .entries(loadPage(guildId, category, 0, pageSize))
                .lastInteraction(registry.now())
                .build());
        return BrowserRenderer.render(next, null);
    }

    public BrowserView next(String sessionId, long guildId) {
        BrowserState state = registry.claim(sessionId, guildId);
        requireStage(state, BrowserStage.PAGED_LIST, "Select a category first.");

        if (state.isLastPage()) {
            return BrowserRenderer.render(touch(state), "Already on the last page.");
        }
        return BrowserRenderer.render(turnTo(state, state.getPage() + 1), null);
    }

    public BrowserView previous(String sessionId, long guildId) {
        BrowserState state = registry.claim(sessionId, guildId);
        requireStage(state, BrowserStage.PAGED_LIST, "Select a category first.");

        if (state.isFirstPage()) {
            return BrowserRenderer.render(touch(state), "Already on the first page.");
        }
        return BrowserRenderer.render(turnTo(state, state.getPage() - 1), null);
    }

    public BrowserView back(String sessionId, long guildId) {
        BrowserState state = registry.claim(sessionId, guildId);
        requireStage(state, BrowserStage.PAGED_LIST, "Already on the category list.");

        BrowserState next = registry.save(state.toBuilder()
                .stage(BrowserStage.CATEGORY_SELECT)
                .categories(shortcutStore.countByCategory(guildId))
                .category(null)
                .page(0)
                .maxPages(0)
                .entries(List.of())
                .lastInteraction(registry.now())
                .build());
        return BrowserRenderer.render(next, null);
    }

    private BrowserState turnTo(BrowserState state, int page) {
        return registry.save(state.toBuilder()
                .page(page)
                .entries(loadPage(state.getGuildId(), state.getCategory(), page, state.getPageSize()))
                .lastInteraction(registry.now())
                .build());
    }

    private BrowserState touch(BrowserState state) {
        return registry.save(state.toBuilder()
                .lastInteraction(registry.now())
                .build());
    }

    private List<ShortcutEntry> loadPage(long guildId, String category, int page, int pageSize) {
        return shortcutStore.findPage(guildId, category, page, pageSize).getContent();
    }

    private int pageSizeOf(GuildSettings settings) {
        if (settings == null || settings.getPageSize() == null) {
            return GuildSettings.DEFAULT_PAGE_SIZE;
        }
        return settings.getPageSize();
    }

    private void requireStage(BrowserState state, BrowserStage expected, String message) {
        if (state.getStage() != expected) {
            throw new ValidationException(message);
        }
    }
}
