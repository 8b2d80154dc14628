package com.diamondline.ingest.repository;

import com.diamondline.ingest.model.AliasResolutionAudit;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AliasResolutionAuditRepository extends JpaRepository<AliasResolutionAudit, Long> {
    Page<AliasResolutionAudit> findAllByOrderByResolvedAtDesc(Pageable pageable);
    List<AliasResolutionAudit> findAllBySourceAndRawToken(String source, String rawToken);
}
