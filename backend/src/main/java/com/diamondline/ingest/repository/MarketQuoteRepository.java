package com.diamondline.ingest.repository;

import com.diamondline.ingest.model.MarketQuote;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Optional;

public interface MarketQuoteRepository extends JpaRepository<MarketQuote, Long> {
    boolean existsBySourceAndMarketIdAndRunnerIdAndObservedAt(String source, String marketId, String runnerId, Instant observedAt);
    Optional<MarketQuote> findFirstBySourceAndMarketIdAndRunnerIdAndObservedAtLessThanOrderByObservedAtDesc(String source, String marketId, String runnerId, Instant observedAt);
    long countBySourceAndMarketIdAndRunnerId(String source, String marketId, String runnerId);
}
