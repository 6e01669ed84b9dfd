package com.williamcallahan.flowindex.service;

/**
 * Signals that the ingestion worker pool rejected a job because its queue is full.
 */
public class IngestionQueueFullException extends IngestionException {

    public IngestionQueueFullException(String fileId, Throwable cause) {
        super("Ingestion queue full; job " + fileId + " was not started", cause);
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}
