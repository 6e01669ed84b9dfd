package com.williamcallahan.flowindex.domain.ingestion;

import java.util.Objects;

/**
 * Snapshot of a collection's configuration and size.
 *
 * @param name collection name
 * @param pointsCount number of stored points
 * @param status collection status as reported by the vector store
 * @param vectorSize configured vector dimensionality
 * @param distance configured distance metric
 */
public record CollectionInfo(String name, long pointsCount, String status, int vectorSize, String distance) {

    public CollectionInfo {
        Objects.requireNonNull(name, "name");
        status = status == null ? "" : status;
        distance = distance == null ? "" : distance;
        if (pointsCount < 0) {
            throw new IllegalArgumentException("pointsCount must not be negative");
        }
    }
}
