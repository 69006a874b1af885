package com.guildshortcuts.service.browser;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class BrowserLine {
    private String trigger;
    private String value;
}
