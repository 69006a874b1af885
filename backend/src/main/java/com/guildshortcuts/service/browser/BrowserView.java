package com.guildshortcuts.service.browser;

import com.guildshortcuts.model.dto.CategoryCount;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * What the platform gateway draws for a browser session: a title, either the
 * category list or one page of shortcuts, and the actions it may offer next.
 */
@Data
@Builder
@AllArgsConstructor
public class BrowserView {
    private String sessionId;
    private BrowserStage stage;
    private String title;
    private List<CategoryCount> categories;
    private String category;
    private List<BrowserLine> lines;
    private Integer page;
    private Integer maxPages;
    private String footer;
    private String notice;
    private List<BrowserAction> actions;
}
