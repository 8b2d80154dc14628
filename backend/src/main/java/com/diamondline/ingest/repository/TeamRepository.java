package com.diamondline.ingest.repository;

import com.diamondline.ingest.model.Team;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface TeamRepository extends JpaRepository<Team, Long> {
    Optional<Team> findByAbbreviation(String abbreviation);
    List<Team> findAllByNormalizedName(String normalizedName);
}
