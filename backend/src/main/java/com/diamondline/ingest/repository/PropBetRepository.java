package com.diamondline.ingest.repository;

import com.diamondline.ingest.model.BetStatus;
import com.diamondline.ingest.model.PropBet;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface PropBetRepository extends JpaRepository<PropBet, Long> {
    Optional<PropBet> findByBetId(String betId);
    long countByStatus(BetStatus status);

    @Query("select b.id from PropBet b where b.status = :status order by b.id asc")
    List<Long> findIdsByStatus(@Param("status") BetStatus status);
}
