package com.diamondline.ingest.repository;

import com.diamondline.ingest.model.BetSettlement;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface BetSettlementRepository extends JpaRepository<BetSettlement, Long> {
    Optional<BetSettlement> findByPropBetId(Long propBetId);
    boolean existsByPropBetId(Long propBetId);
}
