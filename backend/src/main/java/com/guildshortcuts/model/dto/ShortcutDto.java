package com.guildshortcuts.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
@AllArgsConstructor
public class ShortcutDto {
    private String name;
    private String trigger;
    private String value;
    private String category;
    private OffsetDateTime createdAt;
}
