package com.diamondline.ingest.repository;

import com.diamondline.ingest.model.ProcessingWatermark;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface ProcessingWatermarkRepository extends JpaRepository<ProcessingWatermark, String> {
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select w from ProcessingWatermark w where w.jobName = :jobName")
    Optional<ProcessingWatermark> findForUpdate(@Param("jobName") String jobName);
}
