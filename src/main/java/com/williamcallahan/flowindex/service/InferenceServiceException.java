package com.williamcallahan.flowindex.service;

/**
 * Signals that the inference service answered with a non-2xx status or could not be reached.
 */
public class InferenceServiceException extends IngestionException {

    public InferenceServiceException(String message) {
        super(message);
    }

    public InferenceServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}
