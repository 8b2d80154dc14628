package com.diamondline.ingest.repository;

import com.diamondline.ingest.model.IngestionRun;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface IngestionRunRepository extends JpaRepository<IngestionRun, Long> {
    Page<IngestionRun> findAllByOrderByStartedAtDesc(Pageable pageable);
}
