package com.diamondline.ingest.dto;

public enum RecordType { GAME, BOX_SCORE, PITCH, MARKET_QUOTE, PROP, SEASON_STATS }
