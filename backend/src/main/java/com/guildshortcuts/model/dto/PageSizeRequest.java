package com.guildshortcuts.model.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

@Getter @Setter
public class PageSizeRequest {

    @NotNull(message = "Page size is required")
    private Integer pageSize;
}
