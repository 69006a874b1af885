package com.guildshortcuts.model.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

@Data
public class CategorySelectRequest {
    @NotEmpty
    private String category;
}
