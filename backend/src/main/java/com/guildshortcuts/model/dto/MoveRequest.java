package com.guildshortcuts.model.dto;

import lombok.Data;

@Data
public class MoveRequest {
    private String category;
}
