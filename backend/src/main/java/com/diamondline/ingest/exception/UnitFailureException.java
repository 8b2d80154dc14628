package com.diamondline.ingest.exception;

public class UnitFailureException extends RuntimeException {
    private final String unitKey;

    public UnitFailureException(String unitKey, String message) {
        super(message);
        this.unitKey = unitKey;
    }

    public UnitFailureException(String unitKey, String message, Throwable e) {
        super(message, e);
        this.unitKey = unitKey;
    }

    public String getUnitKey() { return unitKey; }
}
