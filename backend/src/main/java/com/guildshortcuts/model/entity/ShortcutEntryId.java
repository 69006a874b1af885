package com.guildshortcuts.model.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ShortcutEntryId implements Serializable {
    private Long guildId;
    private String name;
}
