package com.diamondline.ingest.dto;

import java.time.Instant;

public record AliasAuditDTO(Long id, String source, String kind, String rawToken, String method,
                            Long canonicalId, String detail, Instant resolvedAt) {}
