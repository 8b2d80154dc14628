package com.diamondline.ingest.model;

public enum ResolutionMethod {
    EXACT,
    NORMALIZED,
    ABBREVIATION,
    FUZZY,
    REGISTERED
}
