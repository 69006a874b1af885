package com.guildshortcuts.repository;

import com.guildshortcuts.model.entity.ShortcutEntry;
import com.guildshortcuts.model.entity.ShortcutEntryId;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ShortcutEntryRepository extends JpaRepository<ShortcutEntry, ShortcutEntryId> {
    Optional<ShortcutEntry> findByGuildIdAndNameIgnoreCase(Long guildId, String name);

    List<ShortcutEntry> findByGuildIdOrderByCreatedAtAsc(Long guildId);

    Page<ShortcutEntry> findByGuildIdAndCategory(Long guildId, String category, Pageable pageable);

    long countByGuildIdAndCategory(Long guildId, String category);

    long countByGuildId(Long guildId);

    @Query("SELECT s.name FROM ShortcutEntry s WHERE s.guildId = :guildId ORDER BY s.name")
    List<String> findNamesByGuildId(@Param("guildId") Long guildId);

    @Query("SELECT s.category, COUNT(s) " +
           "FROM ShortcutEntry s WHERE s.guildId = :guildId " +
           "GROUP BY s.category ORDER BY s.category")
    List<Object[]> countGroupedByCategory(@Param("guildId") Long guildId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ShortcutEntry s SET s.category = :target WHERE s.guildId = :guildId AND s.category = :category")
    int reassignCategory(@Param("guildId") Long guildId, @Param("category") String category,
                         @Param("target") String target);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM ShortcutEntry s WHERE s.guildId = :guildId AND s.category = :category")
    int deleteByGuildIdAndCategory(@Param("guildId") Long guildId, @Param("category") String category);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM ShortcutEntry s WHERE s.guildId = :guildId")
    int deleteAllByGuildId(@Param("guildId") Long guildId);
}
