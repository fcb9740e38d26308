package com.example.indexingtelemetry.exception;

/**
 * The event store could not be reached or prepared. Telemetry is disabled
 * for the lifetime of the process; the indexing pipeline keeps running.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
