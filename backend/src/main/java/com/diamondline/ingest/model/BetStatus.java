package com.diamondline.ingest.model;

public enum BetStatus {
    OPEN,
    WON,
    LOST,
    PUSH,
    VOID;

    public boolean isSettled() {
        return this != OPEN;
    }
}
