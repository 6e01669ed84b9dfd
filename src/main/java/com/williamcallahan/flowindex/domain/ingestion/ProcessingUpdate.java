package com.williamcallahan.flowindex.domain.ingestion;

import java.util.Optional;

/**
 * Partial change applied to a {@link ProcessingEntry}; absent fields keep their current value.
 */
public final class ProcessingUpdate {

    private static final ProcessingUpdate EMPTY = new ProcessingUpdate(null, null, null, null, null);

    private final ProcessingStatus status;
    private final Integer currentChunk;
    private final Integer totalChunks;
    private final Integer chunksCreated;
    private final String error;

    private ProcessingUpdate(
            ProcessingStatus status, Integer currentChunk, Integer totalChunks, Integer chunksCreated, String error) {
        this.status = status;
        this.currentChunk = currentChunk;
        this.totalChunks = totalChunks;
        this.chunksCreated = chunksCreated;
        this.error = error;
    }

    public static ProcessingUpdate empty() {
        return EMPTY;
    }

    public static ProcessingUpdate status(ProcessingStatus status) {
        return EMPTY.withStatus(status);
    }

    /**
     * Builds the terminal update for a failed job.
     */
    public static ProcessingUpdate failed(String reason) {
        return EMPTY.withStatus(ProcessingStatus.FAILED).withError(reason);
    }

    public ProcessingUpdate withStatus(ProcessingStatus newStatus) {
        return new ProcessingUpdate(newStatus, currentChunk, totalChunks, chunksCreated, error);
    }

    public ProcessingUpdate withCurrentChunk(int newCurrentChunk) {
        return new ProcessingUpdate(status, newCurrentChunk, totalChunks, chunksCreated, error);
    }

    public ProcessingUpdate withTotalChunks(int newTotalChunks) {
        return new ProcessingUpdate(status, currentChunk, newTotalChunks, chunksCreated, error);
    }

    public ProcessingUpdate withChunksCreated(int newChunksCreated) {
        return new ProcessingUpdate(status, currentChunk, totalChunks, newChunksCreated, error);
    }

    public ProcessingUpdate withError(String newError) {
        return new ProcessingUpdate(status, currentChunk, totalChunks, chunksCreated, newError);
    }

    public Optional<ProcessingStatus> status() {
        return Optional.ofNullable(status);
    }

    public Optional<Integer> currentChunk() {
        return Optional.ofNullable(currentChunk);
    }

    public Optional<Integer> totalChunks() {
        return Optional.ofNullable(totalChunks);
    }

    public Optional<Integer> chunksCreated() {
        return Optional.ofNullable(chunksCreated);
    }

    public Optional<String> error() {
        return Optional.ofNullable(error);
    }
}
