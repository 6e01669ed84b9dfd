package com.williamcallahan.flowindex.domain.ingestion;

/**
 * Status labels reported for tracked ingestion jobs.
 */
public enum ProcessingStatus {
    PROCESSING("processing"),
    READING_FILE("reading_file"),
    CREATING_CHUNKS("creating_chunks"),
    GENERATING_EMBEDDINGS("generating_embeddings"),
    UPLOADING("uploading"),
    FAILED("failed");

    private final String label;

    ProcessingStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == FAILED;
    }
}
