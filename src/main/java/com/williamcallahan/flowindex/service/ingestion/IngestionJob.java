package com.williamcallahan.flowindex.service.ingestion;

import com.williamcallahan.flowindex.domain.ingestion.DocumentPoint;
import com.williamcallahan.flowindex.domain.ingestion.ExtractedContent;
import com.williamcallahan.flowindex.domain.ingestion.FileType;
import com.williamcallahan.flowindex.domain.ingestion.IngestionRequest;
import com.williamcallahan.flowindex.domain.ingestion.PointMetadata;
import com.williamcallahan.flowindex.domain.ingestion.ProcessingUpdate;
import com.williamcallahan.flowindex.service.IngestionException;
import com.williamcallahan.flowindex.service.NoIndexableChunksException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one accepted upload through extraction, chunking, embedding and upsert.
 *
 * <p>Chunks whose embedding fails are skipped; the job fails only when no chunk could be
 * embedded. On success the tracker entry is removed; on failure it is left in {@code failed}
 * with the reason. The stored upload is deleted either way. An {@link Error} is recorded as a
 * failure and then rethrown to the executor.</p>
 */
final class IngestionJob implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(IngestionJob.class);
    private static final Logger INDEXING_LOG = LoggerFactory.getLogger("INDEXING");

    static final int PROGRESS_INTERVAL = 5;

    private final IngestionPipelineServices services;
    private final IngestionRequest request;
    private final long fileSize;
    private IngestionState state = IngestionState.ACCEPTED;

    IngestionJob(IngestionPipelineServices services, IngestionRequest request, long fileSize) {
        this.services = Objects.requireNonNull(services, "services");
        this.request = Objects.requireNonNull(request, "request");
        this.fileSize = fileSize;
    }

    IngestionState state() {
        return state;
    }

    @Override
    public void run() {
        long startMillis = System.currentTimeMillis();
        try {
            advance(IngestionEvent.START);
            ExtractedContent content = services.extractor().extract(request.filePath(), request.includeImages());

            advance(IngestionEvent.CONTENT_EXTRACTED);
            List<String> chunks = nonBlankChunks(content.text());

            advance(IngestionEvent.CHUNKS_CREATED, ProcessingUpdate.empty().withTotalChunks(chunks.size()));
            List<DocumentPoint> points = embedChunks(chunks, content.fileType());

            advance(IngestionEvent.EMBEDDINGS_GENERATED, ProcessingUpdate.empty().withChunksCreated(points.size()));
            services.vectorStore().upsertPoints(request.scope(), points);

            advance(IngestionEvent.UPSERTED);
            services.tracker().remove(request.fileId());
            INDEXING_LOG.info(
                    "[INDEXING] Indexed {} into {} ({} of {} chunks, {} ms)",
                    request.fileName(),
                    request.scope().collectionName(),
                    points.size(),
                    chunks.size(),
                    System.currentTimeMillis() - startMillis);
        } catch (RuntimeException failure) {
            fail(failure);
        } catch (Error fatal) {
            // record the failure before the worker thread dies
            fail(fatal);
            throw fatal;
        } finally {
            services.uploads().deleteQuietly(request.filePath());
        }
    }

    private List<String> nonBlankChunks(String text) {
        List<String> chunks = new ArrayList<>();
        for (String chunk : services.chunker().chunk(text, request.chunkSize(), request.chunkOverlap())) {
            if (!chunk.isBlank()) {
                chunks.add(chunk);
            }
        }
        log.debug("[INDEXING] {} produced {} chunks", request.fileName(), chunks.size());
        return chunks;
    }

    private List<DocumentPoint> embedChunks(List<String> chunks, FileType fileType) {
        Instant uploadedAt = services.clock().instant();
        List<DocumentPoint> points = new ArrayList<>(chunks.size());
        RuntimeException lastFailure = null;
        for (int chunkIdx = 0; chunkIdx < chunks.size(); chunkIdx++) {
            if (chunkIdx % PROGRESS_INTERVAL == 0) {
                services.tracker().update(request.fileId(), ProcessingUpdate.empty().withCurrentChunk(chunkIdx + 1));
            }
            String chunk = chunks.get(chunkIdx);
            try {
                float[] vector = services.embeddings().embedText(chunk);
                points.add(new DocumentPoint(UUID.randomUUID(), vector, chunk, metadata(chunkIdx, fileType, uploadedAt)));
            } catch (RuntimeException embeddingFailure) {
                lastFailure = embeddingFailure;
                log.warn(
                        "[INDEXING] Skipping chunk {} of {}: {}",
                        chunkIdx,
                        request.fileName(),
                        services.failures().describe(embeddingFailure));
            }
        }
        if (points.isEmpty()) {
            boolean retriable = lastFailure instanceof IngestionException pipelineFailure && pipelineFailure.isRetriable();
            throw new NoIndexableChunksException("No valid chunks were created from the file", retriable, lastFailure);
        }
        return points;
    }

    private PointMetadata metadata(int chunkIdx, FileType fileType, Instant uploadedAt) {
        return new PointMetadata(
                request.filePath().toString(),
                request.fileId(),
                chunkIdx,
                request.fileName(),
                fileType,
                request.scope().flowId(),
                request.includeImages(),
                fileSize,
                uploadedAt);
    }

    private void advance(IngestionEvent event) {
        advance(event, ProcessingUpdate.empty());
    }

    private void advance(IngestionEvent event, ProcessingUpdate extraFields) {
        state = IngestionTransitions.next(state, event);
        state.trackerStatus()
                .ifPresent(status -> services.tracker().update(request.fileId(), extraFields.withStatus(status)));
    }

    private void fail(Throwable failure) {
        String reason = services.failures().describe(failure);
        if (state.isTerminal()) {
            log.warn("[INDEXING] Post-completion failure for {}: {}", request.fileName(), reason);
            return;
        }
        state = IngestionTransitions.next(state, IngestionEvent.ERROR);
        services.tracker().update(request.fileId(), ProcessingUpdate.failed(reason));
        log.error("[INDEXING] Failed to index {} into {}: {}", request.fileName(), request.scope().collectionName(), reason);
    }
}
