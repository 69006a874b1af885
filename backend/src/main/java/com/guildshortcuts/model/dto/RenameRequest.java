package com.guildshortcuts.model.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

@Data
public class RenameRequest {
    @NotEmpty
    private String newName;
}
