package com.diamondline.ingest.model;

public enum BetSide {
    OVER,
    UNDER
}
