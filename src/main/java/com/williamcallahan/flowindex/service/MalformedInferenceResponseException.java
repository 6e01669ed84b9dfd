package com.williamcallahan.flowindex.service;

/**
 * Signals a 2xx inference response that lacks the expected field or carries unusable values.
 */
public class MalformedInferenceResponseException extends IngestionException {

    public MalformedInferenceResponseException(String message) {
        super(message);
    }

    public MalformedInferenceResponseException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetriable() {
        return false;
    }
}
