package com.guildshortcuts.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;

@Entity
@Table(name = "guild_settings")
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class GuildSettings {

    public static final int DEFAULT_PAGE_SIZE = 10;

    @Id
    @Column(name = "guild_id")
    private Long guildId;

    @Column(nullable = false)
    private String prefix;

    @Column(name = "page_size", nullable = false)
    @Builder.Default
    private Integer pageSize = DEFAULT_PAGE_SIZE;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @CreationTimestamp
    @Column(name = "created_at")
    private OffsetDateTime createdAt;
}
