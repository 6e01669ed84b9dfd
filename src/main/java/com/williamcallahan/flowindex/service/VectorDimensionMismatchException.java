package com.williamcallahan.flowindex.service;

/**
 * Signals vectors whose length differs from the collection's configured dimensionality.
 */
public class VectorDimensionMismatchException extends VectorStoreException {

    public VectorDimensionMismatchException(String collectionName, int expected, int actual) {
        super("Collection '" + collectionName + "' expects vectors of size " + expected + " but received " + actual);
    }

    @Override
    public boolean isRetriable() {
        return false;
    }
}
