package com.diamondline.ingest.dto;

public record UnitPushResponse(String unitKey, int inserted, int updated, int skipped, int rejected) {}
