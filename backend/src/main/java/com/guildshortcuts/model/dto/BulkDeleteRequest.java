package com.guildshortcuts.model.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

@Data
public class BulkDeleteRequest {
    /** A category name, or the literal "all". */
    @NotEmpty
    private String target;
    private String confirm;
}
