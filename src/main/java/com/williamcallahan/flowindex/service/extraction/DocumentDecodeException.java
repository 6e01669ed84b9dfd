package com.williamcallahan.flowindex.service.extraction;

import com.williamcallahan.flowindex.service.IngestionException;

/**
 * Signals a document whose bytes could not be decoded as its detected type.
 */
public class DocumentDecodeException extends IngestionException {

    public DocumentDecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetriable() {
        return false;
    }
}
