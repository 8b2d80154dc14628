package com.diamondline.ingest.repository;

import com.diamondline.ingest.model.Player;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface PlayerRepository extends JpaRepository<Player, Long> {
    List<Player> findAllByNormalizedName(String normalizedName);

    @Modifying
    @Query("update Player p set p.lastSeenAt = :seenAt where p.id in :ids and (p.lastSeenAt is null or p.lastSeenAt < :seenAt)")
    int touchLastSeen(@Param("ids") Collection<Long> ids, @Param("seenAt") Instant seenAt);
}
