package com.guildshortcuts.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;

@Entity
@Table(name = "shortcuts")
@IdClass(ShortcutEntryId.class)
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class ShortcutEntry {

    public static final String DEFAULT_CATEGORY = "General";

    @Id
    @Column(name = "guild_id")
    private Long guildId;

    // 20 code points, up to 40 UTF-16 units
    @Id
    @Column(length = 40)
    private String name;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String value;

    @Column(nullable = false, length = 50)
    @Builder.Default
    private String category = DEFAULT_CATEGORY;

    @CreationTimestamp
    @Column(name = "created_at")
    private OffsetDateTime createdAt;
}
