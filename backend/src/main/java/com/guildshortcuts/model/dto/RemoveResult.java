package com.guildshortcuts.model.dto;

public enum RemoveResult {
    REMOVED,
    NOT_FOUND
}
