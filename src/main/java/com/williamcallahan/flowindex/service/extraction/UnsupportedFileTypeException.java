package com.williamcallahan.flowindex.service.extraction;

import com.williamcallahan.flowindex.service.IngestionException;

/**
 * Signals a file whose type could not be detected or has no extractor.
 */
public class UnsupportedFileTypeException extends IngestionException {

    public UnsupportedFileTypeException(String message) {
        super(message);
    }

    public UnsupportedFileTypeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetriable() {
        return false;
    }
}
