package com.guildshortcuts.repository;

import com.guildshortcuts.model.entity.GuildSettings;
import org.springframework.data.jpa.repository.JpaRepository;

public interface GuildSettingsRepository extends JpaRepository<GuildSettings, Long> {
}
