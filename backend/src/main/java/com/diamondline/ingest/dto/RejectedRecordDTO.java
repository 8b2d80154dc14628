package com.diamondline.ingest.dto;

public record RejectedRecordDTO(Long id, String unitKey, String recordType, String category, String reason, String payload) {}
