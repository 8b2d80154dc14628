package com.diamondline.ingest.model;

public enum EntityKind {
    TEAM,
    PLAYER,
    GAME
}
