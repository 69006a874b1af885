package com.guildshortcuts.service.browser;

public enum BrowserStage {
    CATEGORY_SELECT,
    PAGED_LIST
}
