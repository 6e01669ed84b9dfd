package com.williamcallahan.flowindex.service;

/**
 * Signals that an inference call did not complete within its configured read timeout.
 */
public class InferenceTimeoutException extends IngestionException {

    public InferenceTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}
