package com.guildshortcuts.model.dto;

import lombok.*;

import java.time.OffsetDateTime;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class GuildSettingsResponse {
    private Long guildId;
    private String prefix;
    private Integer pageSize;
    private OffsetDateTime updatedAt;
}
