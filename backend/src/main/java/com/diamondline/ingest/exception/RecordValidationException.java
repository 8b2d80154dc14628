package com.diamondline.ingest.exception;

public class RecordValidationException extends RuntimeException {
    private final String field;

    public RecordValidationException(String field, String message) {
        super(field == null ? message : field + ": " + message);
        this.field = field;
    }

    public String getField() { return field; }
}
