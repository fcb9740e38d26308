package com.example.indexingtelemetry.exception;

/**
 * A batch of events could not be written. Batches are never retried.
 */
public class WriteFailedException extends RuntimeException {

    private final int batchSize;

    public WriteFailedException(String message, int batchSize, Throwable cause) {
        super(message, cause);
        this.batchSize = batchSize;
    }

    public int getBatchSize() {
        return batchSize;
    }
}
