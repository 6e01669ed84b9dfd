package com.williamcallahan.flowindex.service.ingestion;

import com.williamcallahan.flowindex.domain.ingestion.ProcessingStatus;
import java.util.Optional;

/**
 * Lifecycle states of one ingestion job.
 */
public enum IngestionState {
    ACCEPTED,
    READING_FILE,
    CREATING_CHUNKS,
    GENERATING_EMBEDDINGS,
    UPLOADING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    /**
     * Maps the state to the status label published through the tracker.
     *
     * @return tracker status, empty for {@link #DONE} since finished jobs leave the tracker
     */
    public Optional<ProcessingStatus> trackerStatus() {
        return switch (this) {
            case ACCEPTED -> Optional.of(ProcessingStatus.PROCESSING);
            case READING_FILE -> Optional.of(ProcessingStatus.READING_FILE);
            case CREATING_CHUNKS -> Optional.of(ProcessingStatus.CREATING_CHUNKS);
            case GENERATING_EMBEDDINGS -> Optional.of(ProcessingStatus.GENERATING_EMBEDDINGS);
            case UPLOADING -> Optional.of(ProcessingStatus.UPLOADING);
            case FAILED -> Optional.of(ProcessingStatus.FAILED);
            case DONE -> Optional.empty();
        };
    }
}
