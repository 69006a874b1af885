package com.guildshortcuts.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class DispatchReply {
    private Long channelId;
    private String reply;
}
