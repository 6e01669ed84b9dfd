package com.williamcallahan.flowindex.service.ingestion;

import com.williamcallahan.flowindex.service.Chunker;
import com.williamcallahan.flowindex.service.EmbeddingClient;
import com.williamcallahan.flowindex.service.ProcessingTracker;
import com.williamcallahan.flowindex.service.VectorStoreGateway;
import com.williamcallahan.flowindex.service.extraction.ContentExtractor;
import java.time.Clock;
import org.springframework.stereotype.Service;

/**
 * Groups the collaborators an ingestion job calls, so jobs and the orchestrator take a single
 * cohesive dependency.
 *
 * @param extractor type detection and text extraction
 * @param chunker sliding-window splitter
 * @param embeddings inference client for chunk vectors
 * @param vectorStore collection and point operations
 * @param tracker job status registry
 * @param uploads stored upload files
 * @param failures failure reason formatter
 * @param clock timestamp source for point metadata
 */
@Service
public record IngestionPipelineServices(
        ContentExtractor extractor,
        Chunker chunker,
        EmbeddingClient embeddings,
        VectorStoreGateway vectorStore,
        ProcessingTracker tracker,
        UploadStorageService uploads,
        IngestionFailureDescriber failures,
        Clock clock) {}
