package com.williamcallahan.flowindex.service;

/**
 * Signals that a document with the same stored path is already indexed in the collection.
 */
public class DuplicateDocumentException extends IngestionException {

    public DuplicateDocumentException(String collectionName, String filePath) {
        super("File '" + filePath + "' is already indexed in collection '" + collectionName + "'");
    }

    @Override
    public boolean isRetriable() {
        return false;
    }
}
