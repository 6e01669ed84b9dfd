package com.williamcallahan.flowindex.domain.ingestion;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Tracked state of one in-flight or failed ingestion job.
 *
 * @param fileId job key
 * @param flowId owning flow
 * @param collectionName target collection
 * @param fileName original file name
 * @param status current status
 * @param currentChunk index of the chunk most recently embedded
 * @param totalChunks number of chunks to embed, 0 until chunking completes
 * @param chunksCreated number of chunks produced by the chunker
 * @param startedAt registration time
 * @param lastUpdated time of the most recent update
 * @param error failure reason, {@code null} unless status is failed
 */
public record ProcessingEntry(
        String fileId,
        String flowId,
        String collectionName,
        String fileName,
        ProcessingStatus status,
        int currentChunk,
        int totalChunks,
        int chunksCreated,
        Instant startedAt,
        Instant lastUpdated,
        String error) {

    public ProcessingEntry {
        Objects.requireNonNull(fileId, "fileId");
        Objects.requireNonNull(flowId, "flowId");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(lastUpdated, "lastUpdated");
        collectionName = collectionName == null ? flowId : collectionName;
        fileName = fileName == null ? "" : fileName;
    }

    /**
     * Creates the entry for a newly accepted job.
     */
    public static ProcessingEntry accepted(
            String fileId, String flowId, String collectionName, String fileName, Instant now) {
        return new ProcessingEntry(
                fileId, flowId, collectionName, fileName, ProcessingStatus.PROCESSING, 0, 0, 0, now, now, null);
    }

    /**
     * Returns a copy with the non-empty fields of {@code update} merged in and {@code lastUpdated} set to {@code now}.
     */
    public ProcessingEntry merge(ProcessingUpdate update, Instant now) {
        Objects.requireNonNull(update, "update");
        return new ProcessingEntry(
                fileId,
                flowId,
                collectionName,
                fileName,
                update.status().orElse(status),
                update.currentChunk().orElse(currentChunk),
                update.totalChunks().orElse(totalChunks),
                update.chunksCreated().orElse(chunksCreated),
                startedAt,
                now,
                update.error().orElse(error));
    }

    public Optional<String> optionalError() {
        return Optional.ofNullable(error);
    }
}
