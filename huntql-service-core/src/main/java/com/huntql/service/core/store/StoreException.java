package com.huntql.service.core.store;

/** Failure reported by a {@link QueryStore}. */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
