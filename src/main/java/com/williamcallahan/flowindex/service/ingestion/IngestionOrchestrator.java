package com.williamcallahan.flowindex.service.ingestion;

import com.williamcallahan.flowindex.config.AppProperties;
import com.williamcallahan.flowindex.config.IngestionProperties;
import com.williamcallahan.flowindex.domain.ingestion.CollectionCreation;
import com.williamcallahan.flowindex.domain.ingestion.CollectionInfo;
import com.williamcallahan.flowindex.domain.ingestion.CollectionScope;
import com.williamcallahan.flowindex.domain.ingestion.FileDeletionOutcome;
import com.williamcallahan.flowindex.domain.ingestion.FileSummary;
import com.williamcallahan.flowindex.domain.ingestion.FileType;
import com.williamcallahan.flowindex.domain.ingestion.IngestionAccepted;
import com.williamcallahan.flowindex.domain.ingestion.IngestionRequest;
import com.williamcallahan.flowindex.domain.ingestion.ProcessingEntry;
import com.williamcallahan.flowindex.domain.ingestion.ProcessingUpdate;
import com.williamcallahan.flowindex.domain.ingestion.StoredUpload;
import com.williamcallahan.flowindex.service.Chunker;
import com.williamcallahan.flowindex.service.CollectionNotFoundException;
import com.williamcallahan.flowindex.service.DocumentNotIndexedException;
import com.williamcallahan.flowindex.service.DuplicateDocumentException;
import com.williamcallahan.flowindex.service.IngestionQueueFullException;
import com.williamcallahan.flowindex.service.VectorStoreGateway;
import com.williamcallahan.flowindex.service.extraction.UnsupportedFileTypeException;
import com.williamcallahan.flowindex.support.StoredFiles;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Caller-facing entry point: accepts uploads, runs ingestion jobs on the worker pool, reports
 * job status and manages collections and indexed documents.
 */
@Service
public class IngestionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(IngestionOrchestrator.class);

    private final IngestionPipelineServices services;
    private final TaskExecutor ingestionExecutor;
    private final IngestionProperties ingestionProperties;

    public IngestionOrchestrator(
            IngestionPipelineServices services,
            @Qualifier("ingestionExecutor") TaskExecutor ingestionExecutor,
            AppProperties appProperties) {
        this.services = Objects.requireNonNull(services, "services");
        this.ingestionExecutor = Objects.requireNonNull(ingestionExecutor, "ingestionExecutor");
        this.ingestionProperties = Objects.requireNonNull(appProperties, "appProperties").getIngestion();
    }

    /**
     * Stores an upload and queues it for ingestion with the configured chunking defaults.
     */
    public IngestionAccepted upload(CollectionScope scope, String fileName, InputStream content) {
        return upload(
                scope,
                fileName,
                content,
                ingestionProperties.getChunkSize(),
                ingestionProperties.getChunkOverlap(),
                ingestionProperties.isIncludeImages());
    }

    /**
     * Stores an upload and queues it for ingestion.
     *
     * @throws CollectionNotFoundException when the scope's collection has not been created
     */
    public IngestionAccepted upload(
            CollectionScope scope,
            String fileName,
            InputStream content,
            int chunkSize,
            int chunkOverlap,
            boolean includeImages) {
        Objects.requireNonNull(scope, "scope");
        Chunker.validateWindow(chunkSize, chunkOverlap);
        requireCollection(scope);
        StoredUpload stored = services.uploads().store(scope, fileName, content);
        return ingest(IngestionRequest.forUpload(stored, scope, chunkSize, chunkOverlap, includeImages));
    }

    /**
     * Validates an already stored file, registers it with the tracker and queues its job.
     *
     * <p>Pre-checks run in order: chunk window, file type (no network), collection presence,
     * duplicate path. A rejected file is removed from upload storage.</p>
     *
     * @param request stored file and chunking parameters
     * @return acknowledgment with the initial {@code processing} status
     * @throws IllegalArgumentException when the chunk window is invalid
     * @throws UnsupportedFileTypeException when the file type cannot be detected
     * @throws CollectionNotFoundException when the collection is absent
     * @throws DuplicateDocumentException when the path is already indexed
     * @throws IngestionQueueFullException when the worker pool rejects the job
     */
    public IngestionAccepted ingest(IngestionRequest request) {
        Objects.requireNonNull(request, "request");
        Chunker.validateWindow(request.chunkSize(), request.chunkOverlap());
        CollectionScope scope = request.scope();
        String filePath = request.filePath().toString();

        FileType fileType = services.extractor().detectType(request.filePath());
        if (!fileType.isSupported()) {
            services.uploads().deleteQuietly(request.filePath());
            throw new UnsupportedFileTypeException("Unsupported file type for " + request.fileName());
        }
        try {
            requireCollection(scope);
        } catch (CollectionNotFoundException missingCollection) {
            services.uploads().deleteQuietly(request.filePath());
            throw missingCollection;
        }
        if (services.vectorStore().fileExists(scope, filePath)) {
            services.uploads().deleteQuietly(request.filePath());
            throw new DuplicateDocumentException(scope.collectionName(), filePath);
        }

        long fileSize = StoredFiles.sizeIfPresent(filePath).orElse(0L);
        ProcessingEntry entry = services.tracker()
                .add(request.fileId(), scope.flowId(), scope.collectionName(), request.fileName());
        try {
            ingestionExecutor.execute(new IngestionJob(services, request, fileSize));
        } catch (RejectedExecutionException rejected) {
            IngestionQueueFullException queueFull = new IngestionQueueFullException(request.fileId(), rejected);
            services.tracker().update(request.fileId(), ProcessingUpdate.failed(services.failures().describe(queueFull)));
            services.uploads().deleteQuietly(request.filePath());
            throw queueFull;
        }
        log.info("[INGEST] Accepted {} ({}) for {}", request.fileName(), fileType.wireName(), scope.collectionName());
        return new IngestionAccepted(
                request.fileId(), request.fileName(), scope.collectionName(), fileType, entry.status());
    }

    public Optional<ProcessingEntry> status(String fileId) {
        return services.tracker().get(fileId);
    }

    /**
     * Returns tracked jobs of one collection scope, oldest first.
     */
    public List<ProcessingEntry> statusByScope(CollectionScope scope) {
        Objects.requireNonNull(scope, "scope");
        List<ProcessingEntry> matches = new ArrayList<>();
        for (ProcessingEntry entry : services.tracker().getByFlow(scope.flowId())) {
            if (entry.collectionName().equals(scope.collectionName())) {
                matches.add(entry);
            }
        }
        return matches;
    }

    /**
     * Removes every point of one document, then its stored file.
     *
     * @param scope owning collection scope
     * @param filePath stored path recorded in point metadata
     * @return vector-store and physical-file outcomes, reported independently
     * @throws CollectionNotFoundException when the collection is absent
     * @throws DocumentNotIndexedException when no point references the path
     */
    public FileDeletionOutcome delete(CollectionScope scope, String filePath) {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(filePath, "filePath");
        VectorStoreGateway vectorStore = services.vectorStore();
        requireCollection(scope);
        if (!vectorStore.fileExists(scope, filePath)) {
            throw new DocumentNotIndexedException(scope.collectionName(), filePath);
        }
        long pointsDeleted = vectorStore.deleteByFilePath(scope, filePath);
        boolean physicalFileDeleted = services.uploads().deleteQuietly(Path.of(filePath));
        log.info(
                "[INGEST] Deleted {} points for {} from {} (file removed: {})",
                pointsDeleted,
                filePath,
                scope.collectionName(),
                physicalFileDeleted);
        return FileDeletionOutcome.of(pointsDeleted, physicalFileDeleted);
    }

    /**
     * Creates the scope's collection sized to the configured embedding model.
     */
    public CollectionCreation createCollection(CollectionScope scope) {
        Objects.requireNonNull(scope, "scope");
        int vectorSize = services.embeddings().vectorSize();
        CollectionCreation creation = services.vectorStore().createCollection(scope, vectorSize);
        log.info(
                "[INGEST] Collection {} {} (vector size {})",
                scope.collectionName(),
                creation.created() ? "created" : "already existed",
                vectorSize);
        return creation;
    }

    /**
     * Drops the scope's collection.
     *
     * @return number of points the collection held, 0 when it was absent
     */
    public long deleteCollection(CollectionScope scope) {
        Objects.requireNonNull(scope, "scope");
        VectorStoreGateway vectorStore = services.vectorStore();
        long pointsRemoved = vectorStore.collectionInfo(scope).map(CollectionInfo::pointsCount).orElse(0L);
        boolean removed = vectorStore.deleteCollection(scope);
        log.info("[INGEST] Collection {} deleted={} ({} points)", scope.collectionName(), removed, pointsRemoved);
        return removed ? pointsRemoved : 0L;
    }

    public Optional<CollectionInfo> collectionInfo(CollectionScope scope) {
        return services.vectorStore().collectionInfo(scope);
    }

    /**
     * Lists indexed documents, flagging those whose job is still tracked and preferring the
     * on-disk size when the stored file is still present.
     *
     * @throws CollectionNotFoundException when the collection is absent
     */
    public List<FileSummary> listFiles(CollectionScope scope) {
        Objects.requireNonNull(scope, "scope");
        requireCollection(scope);
        List<FileSummary> summaries = new ArrayList<>();
        for (FileSummary indexed : services.vectorStore().listIndexedFiles(scope)) {
            FileSummary summary = indexed.withProcessing(services.tracker().isProcessing(indexed.fileId()));
            OptionalLong sizeOnDisk = StoredFiles.sizeIfPresent(indexed.filePath());
            summaries.add(sizeOnDisk.isPresent() ? summary.withFileSize(sizeOnDisk.getAsLong()) : summary);
        }
        return summaries;
    }

    private void requireCollection(CollectionScope scope) {
        if (!services.vectorStore().collectionExists(scope)) {
            throw new CollectionNotFoundException(scope.collectionName());
        }
    }
}
