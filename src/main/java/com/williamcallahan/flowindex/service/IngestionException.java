package com.williamcallahan.flowindex.service;

/**
 * Base type for every failure raised by the ingestion pipeline.
 *
 * <p>Subclasses state whether re-running the whole job could succeed without intervention.</p>
 */
public abstract class IngestionException extends RuntimeException {

    protected IngestionException(String message) {
        super(message);
    }

    protected IngestionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns true when the failure came from a transient network or service condition.
     *
     * @return whether retrying the job is reasonable
     */
    public abstract boolean isRetriable();
}
