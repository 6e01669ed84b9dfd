package com.williamcallahan.flowindex.service;

import static com.williamcallahan.flowindex.service.QdrantFutureAwaiter.awaitFuture;
import static io.qdrant.client.ConditionFactory.matchKeyword;
import static io.qdrant.client.PointIdFactory.id;
import static io.qdrant.client.VectorsFactory.vectors;

import com.williamcallahan.flowindex.config.QdrantProperties;
import com.williamcallahan.flowindex.domain.ingestion.CollectionCreation;
import com.williamcallahan.flowindex.domain.ingestion.CollectionInfo;
import com.williamcallahan.flowindex.domain.ingestion.CollectionScope;
import com.williamcallahan.flowindex.domain.ingestion.DocumentPoint;
import com.williamcallahan.flowindex.domain.ingestion.FileSummary;
import com.williamcallahan.flowindex.domain.ingestion.PointMetadata;
import com.williamcallahan.flowindex.support.RetrySupport;
import com.williamcallahan.flowindex.support.StoredFiles;
import com.williamcallahan.flowindex.support.VectorStoreErrorClassifier;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.WithPayloadSelectorFactory;
import io.qdrant.client.WithVectorsSelectorFactory;
import io.qdrant.client.grpc.Collections;
import io.qdrant.client.grpc.Collections.Distance;
import io.qdrant.client.grpc.Collections.VectorParams;
import io.qdrant.client.grpc.Points.Filter;
import io.qdrant.client.grpc.Points.PointId;
import io.qdrant.client.grpc.Points.PointStruct;
import io.qdrant.client.grpc.Points.RetrievedPoint;
import io.qdrant.client.grpc.Points.ScrollPoints;
import io.qdrant.client.grpc.Points.ScrollResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vector store gateway backed by the Qdrant gRPC client.
 *
 * <p>Every remote call is bounded by {@code app.qdrant.operation-timeout} and retried with
 * backoff when {@link VectorStoreErrorClassifier} judges the failure transient.</p>
 */
public class QdrantVectorStoreGateway implements VectorStoreGateway {

    private static final Logger log = LoggerFactory.getLogger(QdrantVectorStoreGateway.class);

    private final QdrantClient qdrantClient;
    private final QdrantProperties qdrant;

    /**
     * Wires the gRPC client and paging settings.
     *
     * @param qdrantClient Qdrant gRPC client
     * @param qdrant connection and paging configuration
     */
    public QdrantVectorStoreGateway(QdrantClient qdrantClient, QdrantProperties qdrant) {
        this.qdrantClient = Objects.requireNonNull(qdrantClient, "qdrantClient");
        this.qdrant = Objects.requireNonNull(qdrant, "qdrant");
    }

    @Override
    public boolean collectionExists(CollectionScope scope) {
        String collectionName = scope.collectionName();
        Boolean exists = withRetry(
                () -> awaitFuture(qdrantClient.collectionExistsAsync(collectionName), timeout(), "collection exists"),
                "Qdrant collection exists");
        return Boolean.TRUE.equals(exists);
    }

    @Override
    public CollectionCreation createCollection(CollectionScope scope, int vectorSize) {
        if (vectorSize <= 0) {
            throw new IllegalArgumentException("vectorSize must be positive, got " + vectorSize);
        }
        String collectionName = scope.collectionName();
        Optional<CollectionInfo> existing = collectionInfo(scope);
        if (existing.isPresent()) {
            log.info("[QDRANT] Collection {} already exists; leaving it unchanged", collectionName);
            return new CollectionCreation(existing.get(), false);
        }
        VectorParams vectorParams = VectorParams.newBuilder()
                .setDistance(Distance.Cosine)
                .setSize(vectorSize)
                .build();
        withRetry(
                () -> awaitFuture(
                        qdrantClient.createCollectionAsync(collectionName, vectorParams), timeout(), "create collection"),
                "Qdrant create collection");
        log.info("[QDRANT] Created collection {} (size={}, distance=Cosine)", collectionName, vectorSize);
        CollectionInfo created = collectionInfo(scope)
                .orElse(new CollectionInfo(collectionName, 0, "Green", vectorSize, Distance.Cosine.name()));
        return new CollectionCreation(created, true);
    }

    @Override
    public boolean deleteCollection(CollectionScope scope) {
        String collectionName = scope.collectionName();
        if (!collectionExists(scope)) {
            log.debug("[QDRANT] Collection {} absent; nothing to delete", collectionName);
            return false;
        }
        withRetry(
                () -> awaitFuture(qdrantClient.deleteCollectionAsync(collectionName), timeout(), "delete collection"),
                "Qdrant delete collection");
        log.info("[QDRANT] Deleted collection {}", collectionName);
        return true;
    }

    @Override
    public Optional<CollectionInfo> collectionInfo(CollectionScope scope) {
        if (!collectionExists(scope)) {
            return Optional.empty();
        }
        String collectionName = scope.collectionName();
        Collections.CollectionInfo info = withRetry(
                () -> awaitFuture(qdrantClient.getCollectionInfoAsync(collectionName), timeout(), "collection info"),
                "Qdrant collection info");
        VectorParams params = info.getConfig().getParams().getVectorsConfig().getParams();
        return Optional.of(new CollectionInfo(
                collectionName,
                info.getPointsCount(),
                info.getStatus().name(),
                (int) params.getSize(),
                params.getDistance().name()));
    }

    @Override
    public boolean fileExists(CollectionScope scope, String filePath) {
        Objects.requireNonNull(filePath, "filePath");
        String collectionName = scope.collectionName();
        Long count = withRetry(
                () -> awaitFuture(
                        qdrantClient.countAsync(collectionName, filePathFilter(filePath), true),
                        timeout(),
                        "count by file path"),
                "Qdrant count by file path");
        return count != null && count > 0;
    }

    @Override
    public void upsertPoints(CollectionScope scope, List<DocumentPoint> points) {
        Objects.requireNonNull(points, "points");
        if (points.isEmpty()) {
            return;
        }
        String collectionName = scope.collectionName();
        CollectionInfo info = collectionInfo(scope).orElseThrow(() -> new CollectionNotFoundException(collectionName));
        for (DocumentPoint point : points) {
            if (point.vector().length != info.vectorSize()) {
                throw new VectorDimensionMismatchException(collectionName, info.vectorSize(), point.vector().length);
            }
        }

        int batchSize = qdrant.getUpsertBatchSize();
        for (int start = 0; start < points.size(); start += batchSize) {
            List<PointStruct> batch = new ArrayList<>();
            for (DocumentPoint point : points.subList(start, Math.min(start + batchSize, points.size()))) {
                batch.add(toPointStruct(point));
            }
            withRetry(
                    () -> awaitFuture(qdrantClient.upsertAsync(collectionName, batch), timeout(), "upsert"),
                    "Qdrant upsert");
            log.debug("[QDRANT] Upserted batch of {} points into {}", batch.size(), collectionName);
        }
        log.info("[QDRANT] Upserted {} points into {}", points.size(), collectionName);
    }

    @Override
    public long deleteByFilePath(CollectionScope scope, String filePath) {
        Objects.requireNonNull(filePath, "filePath");
        String collectionName = scope.collectionName();
        long[] deleted = {0L};
        scrollAll(collectionName, filePathFilter(filePath), qdrant.getScrollPageSize(), false, page -> {
            List<PointId> ids = new ArrayList<>(page.size());
            for (RetrievedPoint point : page) {
                ids.add(point.getId());
            }
            if (ids.isEmpty()) {
                return;
            }
            withRetry(
                    () -> awaitFuture(qdrantClient.deleteAsync(collectionName, ids), timeout(), "delete points"),
                    "Qdrant delete points");
            deleted[0] += ids.size();
        });
        log.info("[QDRANT] Deleted {} points for {} from {}", deleted[0], filePath, collectionName);
        return deleted[0];
    }

    @Override
    public List<FileSummary> listFiles(CollectionScope scope) {
        List<FileSummary> present = new ArrayList<>();
        for (FileSummary summary : listIndexedFiles(scope)) {
            OptionalLong sizeOnDisk = StoredFiles.sizeIfPresent(summary.filePath());
            if (sizeOnDisk.isPresent()) {
                present.add(summary.withFileSize(sizeOnDisk.getAsLong()));
            } else {
                log.debug("[QDRANT] Skipping {}: stored file no longer exists", summary.filePath());
            }
        }
        return present;
    }

    @Override
    public List<FileSummary> listIndexedFiles(CollectionScope scope) {
        if (!collectionExists(scope)) {
            return List.of();
        }
        Map<String, FileSummary> filesByPath = new LinkedHashMap<>();
        scrollAll(scope.collectionName(), null, qdrant.getListPageSize(), true, page -> {
            for (RetrievedPoint point : page) {
                Optional<PointMetadata> metadata = QdrantPointPayloads.toMetadata(point.getPayloadMap());
                metadata.ifPresent(found ->
                        filesByPath.putIfAbsent(found.filePath(), FileSummary.fromMetadata(found)));
            }
        });
        return new ArrayList<>(filesByPath.values());
    }

    private void scrollAll(
            String collectionName,
            Filter filter,
            int pageSize,
            boolean withPayload,
            Consumer<List<RetrievedPoint>> pageConsumer) {
        PointId offset = null;
        do {
            ScrollPoints.Builder request = ScrollPoints.newBuilder()
                    .setCollectionName(collectionName)
                    .setLimit(pageSize)
                    .setWithPayload(WithPayloadSelectorFactory.enable(withPayload))
                    .setWithVectors(WithVectorsSelectorFactory.enable(false));
            if (filter != null) {
                request.setFilter(filter);
            }
            if (offset != null) {
                request.setOffset(offset);
            }
            ScrollPoints scrollRequest = request.build();
            ScrollResponse response = withRetry(
                    () -> awaitFuture(qdrantClient.scrollAsync(scrollRequest), timeout(), "scroll"),
                    "Qdrant scroll");
            pageConsumer.accept(response.getResultList());
            offset = response.hasNextPageOffset() ? response.getNextPageOffset() : null;
        } while (offset != null);
    }

    private static PointStruct toPointStruct(DocumentPoint point) {
        return PointStruct.newBuilder()
                .setId(id(point.id()))
                .setVectors(vectors(point.vector()))
                .putAllPayload(QdrantPointPayloads.toPayload(point))
                .build();
    }

    private static Filter filePathFilter(String filePath) {
        return Filter.newBuilder()
                .addMust(matchKeyword(QdrantPointPayloads.FILE_PATH_KEY, filePath))
                .build();
    }

    private Duration timeout() {
        return qdrant.getOperationTimeout();
    }

    private <T> T withRetry(Supplier<T> operation, String operationName) {
        return RetrySupport.executeWithRetry(
                operation,
                operationName,
                qdrant.getMaxAttempts(),
                qdrant.getInitialBackoff(),
                VectorStoreErrorClassifier::isTransientVectorStoreError);
    }
}
