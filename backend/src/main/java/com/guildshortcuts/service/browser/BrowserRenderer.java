package com.guildshortcuts.service.browser;

import com.guildshortcuts.model.entity.ShortcutEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure mapping from a browser state to its display and the actions that are
 * valid from it.
 */
public final class BrowserRenderer {

    public static final int DISPLAY_CAP = 1024;
    static final String ELLIPSIS = "...";

    private BrowserRenderer() {
    }

    public static BrowserView render(BrowserState state, String notice) {
        BrowserView.BrowserViewBuilder view = BrowserView.builder()
                .sessionId(state.getSessionId())
                .stage(state.getStage())
                .notice(notice)
                .actions(allowedActions(state));

        switch (state.getStage()) {
            case CATEGORY_SELECT -> view
                    .title("Shortcut categories")
                    .categories(state.getCategories())
                    .lines(List.of())
                    .footer(state.getCategories().isEmpty()
                            ? "No shortcuts for this server!"
                            : "Select a category to browse its shortcuts");
            case PAGED_LIST -> view
                    .title("Shortcuts in " + state.getCategory())
                    .category(state.getCategory())
                    .categories(List.of())
                    .lines(state.getEntries().stream()
                            .map(entry -> toLine(entry, state.getPrefix()))
                            .toList())
                    .page(state.getPage() + 1)
                    .maxPages(state.getMaxPages())
                    .footer("Page " + (state.getPage() + 1) + "/" + Math.max(1, state.getMaxPages()));
        }
        return view.build();
    }

    public static List<BrowserAction> allowedActions(BrowserState state) {
        List<BrowserAction> actions = new ArrayList<>();
        switch (state.getStage()) {
            case CATEGORY_SELECT -> {
                if (!state.getCategories().isEmpty()) {
                    actions.add(BrowserAction.SELECT);
                }
            }
            case PAGED_LIST -> {
                if (!state.isFirstPage()) {
                    actions.add(BrowserAction.PREVIOUS);
                }
                if (!state.isLastPage()) {
                    actions.add(BrowserAction.NEXT);
                }
                actions.add(BrowserAction.BACK);
            }
        }
        return actions;
    }

    /**
     * Display-only truncation, the stored value is left untouched.
     */
    public static String truncate(String value) {
        if (value == null || value.length() <= DISPLAY_CAP) {
            return value;
        }
        int cut = DISPLAY_CAP - ELLIPSIS.length();
        // never split a surrogate pair
        if (Character.isHighSurrogate(value.charAt(cut - 1))) {
            cut--;
        }
        return value.substring(0, cut) + ELLIPSIS;
    }

    private static BrowserLine toLine(ShortcutEntry entry, String prefix) {
        return BrowserLine.builder()
                .trigger(prefix + entry.getName())
                .value(truncate(entry.getValue()))
                .build();
    }
}
