package com.williamcallahan.flowindex.service;

/**
 * Signals that a document produced no chunk that could be embedded.
 */
public class NoIndexableChunksException extends IngestionException {

    private final boolean retriable;

    public NoIndexableChunksException(String message, boolean retriable, Throwable lastFailure) {
        super(message, lastFailure);
        this.retriable = retriable;
    }

    @Override
    public boolean isRetriable() {
        return retriable;
    }
}
