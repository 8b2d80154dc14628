package com.diamondline.ingest.repository;

import com.diamondline.ingest.model.RejectedRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RejectedRecordRepository extends JpaRepository<RejectedRecord, Long> {
    List<RejectedRecord> findAllByIngestionRunIdOrderByIdAsc(Long ingestionRunId);
    long countByIngestionRunId(Long ingestionRunId);
}
