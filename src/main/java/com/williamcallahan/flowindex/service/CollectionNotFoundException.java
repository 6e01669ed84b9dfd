package com.williamcallahan.flowindex.service;

/**
 * Signals that the target collection does not exist; callers must create it before uploading.
 */
public class CollectionNotFoundException extends VectorStoreException {

    private final String collectionName;

    public CollectionNotFoundException(String collectionName) {
        super("Collection '" + collectionName + "' does not exist");
        this.collectionName = collectionName;
    }

    public String collectionName() {
        return collectionName;
    }

    @Override
    public boolean isRetriable() {
        return false;
    }
}
