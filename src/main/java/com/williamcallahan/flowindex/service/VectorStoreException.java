package com.williamcallahan.flowindex.service;

/**
 * Signals a failed vector store operation such as a rejected upsert batch.
 */
public class VectorStoreException extends IngestionException {

    public VectorStoreException(String message) {
        super(message);
    }

    public VectorStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}
