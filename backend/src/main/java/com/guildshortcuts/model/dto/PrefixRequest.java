package com.guildshortcuts.model.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.Setter;

@Getter @Setter
public class PrefixRequest {

    @NotEmpty(message = "Prefix is required")
    private String prefix;
}
