package com.williamcallahan.flowindex.domain.ingestion;

import java.time.Instant;
import java.util.Objects;

/**
 * Metadata stored alongside every chunk vector.
 *
 * <p>{@code filePath} is the key used by per-document existence checks and deletes.</p>
 *
 * @param filePath stored path of the source document
 * @param fileId opaque id assigned at upload
 * @param chunkIdx zero-based chunk position within the document
 * @param fileName original file name
 * @param fileType detected document type
 * @param flowId owning flow id
 * @param includesImages whether image descriptions were requested for the document
 * @param fileSize size of the source document in bytes
 * @param uploadedAt ingestion timestamp
 */
public record PointMetadata(
        String filePath,
        String fileId,
        int chunkIdx,
        String fileName,
        FileType fileType,
        String flowId,
        boolean includesImages,
        long fileSize,
        Instant uploadedAt) {

    public PointMetadata {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(fileId, "fileId");
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(fileType, "fileType");
        Objects.requireNonNull(flowId, "flowId");
        Objects.requireNonNull(uploadedAt, "uploadedAt");
        if (chunkIdx < 0) {
            throw new IllegalArgumentException("chunkIdx must not be negative");
        }
    }
}
