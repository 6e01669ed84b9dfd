package com.williamcallahan.flowindex.domain.ingestion;

import java.time.Instant;
import java.util.Objects;

/**
 * One indexed document as reported by a collection listing.
 *
 * @param fileId opaque id assigned at upload
 * @param fileName original file name
 * @param filePath stored path of the document
 * @param fileType detected type
 * @param fileSize size in bytes, read from disk when available
 * @param includesImages whether image descriptions were indexed
 * @param uploadedAt ingestion timestamp, {@code null} for points written without one
 * @param processing true while an ingestion job for the file is still tracked
 */
public record FileSummary(
        String fileId,
        String fileName,
        String filePath,
        FileType fileType,
        long fileSize,
        boolean includesImages,
        Instant uploadedAt,
        boolean processing) {

    public FileSummary {
        Objects.requireNonNull(filePath, "filePath");
        fileId = fileId == null ? "" : fileId;
        fileName = fileName == null ? "" : fileName;
        fileType = fileType == null ? FileType.UNKNOWN : fileType;
    }

    /**
     * Builds a summary from the metadata of any one of the document's points.
     */
    public static FileSummary fromMetadata(PointMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        return new FileSummary(
                metadata.fileId(),
                metadata.fileName(),
                metadata.filePath(),
                metadata.fileType(),
                metadata.fileSize(),
                metadata.includesImages(),
                metadata.uploadedAt(),
                false);
    }

    public FileSummary withProcessing(boolean stillProcessing) {
        return new FileSummary(fileId, fileName, filePath, fileType, fileSize, includesImages, uploadedAt, stillProcessing);
    }

    public FileSummary withFileSize(long sizeOnDisk) {
        return new FileSummary(fileId, fileName, filePath, fileType, sizeOnDisk, includesImages, uploadedAt, processing);
    }
}
