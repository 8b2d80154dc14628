package com.diamondline.ingest.exception;

/** The store could not be reached at all; the only failure escalated to callers. */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable e) {
        super(message, e);
    }
}
