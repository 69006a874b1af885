package com.guildshortcuts.model.dto;

import lombok.Data;

@Data
public class ShortcutRequest {
    private String value;
    private String category;
}
