package com.guildshortcuts.model.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A chat message as delivered by the platform gateway. {@code guildId} is null
 * for direct messages.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessage {
    private Long guildId;
    private Long channelId;
    private boolean authorBot;
    @NotNull
    private String content;
}
