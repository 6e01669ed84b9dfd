package com.williamcallahan.flowindex.service;

/**
 * Signals a delete request for a file that has no points in the collection.
 */
public class DocumentNotIndexedException extends IngestionException {

    public DocumentNotIndexedException(String collectionName, String filePath) {
        super("File '" + filePath + "' not found in collection '" + collectionName + "'");
    }

    @Override
    public boolean isRetriable() {
        return false;
    }
}
