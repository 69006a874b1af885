package com.guildshortcuts.service.browser;

public enum BrowserAction {
    SELECT,
    NEXT,
    PREVIOUS,
    BACK
}
