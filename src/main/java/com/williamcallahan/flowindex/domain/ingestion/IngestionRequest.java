package com.williamcallahan.flowindex.domain.ingestion;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Everything the orchestrator needs to index one stored upload.
 *
 * @param filePath stored file location
 * @param fileName original file name
 * @param fileId opaque id assigned at upload
 * @param scope target collection scope
 * @param chunkSize chunk window length in characters
 * @param chunkOverlap characters shared between consecutive windows
 * @param includeImages whether embedded images should be described
 */
public record IngestionRequest(
        Path filePath,
        String fileName,
        String fileId,
        CollectionScope scope,
        int chunkSize,
        int chunkOverlap,
        boolean includeImages) {

    public IngestionRequest {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(fileId, "fileId");
        Objects.requireNonNull(scope, "scope");
        if (fileId.isBlank()) {
            throw new IllegalArgumentException("fileId must not be blank");
        }
    }

    /**
     * Builds a request for an upload that was just written by the upload store.
     */
    public static IngestionRequest forUpload(
            StoredUpload upload, CollectionScope scope, int chunkSize, int chunkOverlap, boolean includeImages) {
        Objects.requireNonNull(upload, "upload");
        return new IngestionRequest(
                upload.path(), upload.fileName(), upload.fileId(), scope, chunkSize, chunkOverlap, includeImages);
    }
}
