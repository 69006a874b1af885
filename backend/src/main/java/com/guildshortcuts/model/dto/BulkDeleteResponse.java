package com.guildshortcuts.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class BulkDeleteResponse {
    private String target;
    private boolean confirmed;
    private long matched;
    private int deleted;
    private String message;
}
