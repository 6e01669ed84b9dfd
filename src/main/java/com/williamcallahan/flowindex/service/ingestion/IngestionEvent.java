package com.williamcallahan.flowindex.service.ingestion;

/**
 * Step outcomes that drive an ingestion job between {@link IngestionState}s.
 */
public enum IngestionEvent {
    START,
    CONTENT_EXTRACTED,
    CHUNKS_CREATED,
    EMBEDDINGS_GENERATED,
    UPSERTED,
    ERROR
}
