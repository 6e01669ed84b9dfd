package com.williamcallahan.flowindex.domain.ingestion;

import java.util.Objects;
import java.util.UUID;

/**
 * One embedded chunk ready to be written to the vector store.
 *
 * @param id point id
 * @param vector embedding of {@code pageContent}
 * @param pageContent chunk text
 * @param metadata document metadata for the chunk
 */
public record DocumentPoint(UUID id, float[] vector, String pageContent, PointMetadata metadata) {

    public DocumentPoint {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(vector, "vector");
        Objects.requireNonNull(pageContent, "pageContent");
        Objects.requireNonNull(metadata, "metadata");
        if (vector.length == 0) {
            throw new IllegalArgumentException("vector must not be empty");
        }
    }
}
