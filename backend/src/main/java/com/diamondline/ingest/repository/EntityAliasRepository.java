package com.diamondline.ingest.repository;

import com.diamondline.ingest.model.EntityAlias;
import com.diamondline.ingest.model.EntityKind;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface EntityAliasRepository extends JpaRepository<EntityAlias, Long> {
    Optional<EntityAlias> findBySourceAndKindAndAlias(String source, EntityKind kind, String alias);
    List<EntityAlias> findAllBySourceAndKindAndNormalizedAlias(String source, EntityKind kind, String normalizedAlias);
    List<EntityAlias> findAllByKindAndNormalizedAlias(EntityKind kind, String normalizedAlias);
    List<EntityAlias> findAllByKindAndCanonicalIdOrderByIdAsc(EntityKind kind, Long canonicalId);
    boolean existsBySourceAndKindAndCanonicalId(String source, EntityKind kind, Long canonicalId);
    long countBySourceAndKindAndAlias(String source, EntityKind kind, String alias);
}
