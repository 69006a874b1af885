package com.guildshortcuts.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class CategoryDeleteResponse {
    private String category;
    private int reassigned;
    private String message;
}
