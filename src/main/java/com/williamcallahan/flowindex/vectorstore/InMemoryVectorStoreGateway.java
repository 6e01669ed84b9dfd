package com.williamcallahan.flowindex.vectorstore;

import com.williamcallahan.flowindex.domain.ingestion.CollectionCreation;
import com.williamcallahan.flowindex.domain.ingestion.CollectionInfo;
import com.williamcallahan.flowindex.domain.ingestion.CollectionScope;
import com.williamcallahan.flowindex.domain.ingestion.DocumentPoint;
import com.williamcallahan.flowindex.domain.ingestion.FileSummary;
import com.williamcallahan.flowindex.service.CollectionNotFoundException;
import com.williamcallahan.flowindex.service.VectorDimensionMismatchException;
import com.williamcallahan.flowindex.service.VectorStoreGateway;
import com.williamcallahan.flowindex.support.StoredFiles;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process vector store used when {@code app.vector-store.provider=memory}.
 *
 * <p>Holds points per collection in insertion order. Nothing is persisted.</p>
 */
public class InMemoryVectorStoreGateway implements VectorStoreGateway {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryVectorStoreGateway.class);
    private static final String DISTANCE = "Cosine";
    private static final String STATUS = "Green";

    private final Map<String, MemoryCollection> collections = new HashMap<>();

    public InMemoryVectorStoreGateway() {
        logger.info("Using in-memory vector store; indexed points are lost on restart");
    }

    @Override
    public synchronized boolean collectionExists(CollectionScope scope) {
        return collections.containsKey(scope.collectionName());
    }

    @Override
    public synchronized CollectionCreation createCollection(CollectionScope scope, int vectorSize) {
        if (vectorSize <= 0) {
            throw new IllegalArgumentException("vectorSize must be positive, got " + vectorSize);
        }
        String collectionName = scope.collectionName();
        MemoryCollection existing = collections.get(collectionName);
        if (existing != null) {
            return new CollectionCreation(existing.info(collectionName), false);
        }
        MemoryCollection created = new MemoryCollection(vectorSize);
        collections.put(collectionName, created);
        logger.info("Created in-memory collection {} (size={})", collectionName, vectorSize);
        return new CollectionCreation(created.info(collectionName), true);
    }

    @Override
    public synchronized boolean deleteCollection(CollectionScope scope) {
        return collections.remove(scope.collectionName()) != null;
    }

    @Override
    public synchronized Optional<CollectionInfo> collectionInfo(CollectionScope scope) {
        String collectionName = scope.collectionName();
        return Optional.ofNullable(collections.get(collectionName)).map(found -> found.info(collectionName));
    }

    @Override
    public synchronized boolean fileExists(CollectionScope scope, String filePath) {
        MemoryCollection collection = collections.get(scope.collectionName());
        if (collection == null) {
            return false;
        }
        return collection.points.values().stream()
                .anyMatch(point -> point.metadata().filePath().equals(filePath));
    }

    @Override
    public synchronized void upsertPoints(CollectionScope scope, List<DocumentPoint> points) {
        Objects.requireNonNull(points, "points");
        String collectionName = scope.collectionName();
        MemoryCollection collection = collections.get(collectionName);
        if (collection == null) {
            throw new CollectionNotFoundException(collectionName);
        }
        for (DocumentPoint point : points) {
            if (point.vector().length != collection.vectorSize) {
                throw new VectorDimensionMismatchException(collectionName, collection.vectorSize, point.vector().length);
            }
        }
        for (DocumentPoint point : points) {
            collection.points.put(point.id(), point);
        }
        logger.debug("Upserted {} points into in-memory collection {}", points.size(), collectionName);
    }

    @Override
    public synchronized long deleteByFilePath(CollectionScope scope, String filePath) {
        MemoryCollection collection = collections.get(scope.collectionName());
        if (collection == null) {
            return 0L;
        }
        long removed = 0L;
        Iterator<DocumentPoint> iterator = collection.points.values().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().metadata().filePath().equals(filePath)) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    @Override
    public List<FileSummary> listFiles(CollectionScope scope) {
        List<FileSummary> present = new ArrayList<>();
        for (FileSummary summary : listIndexedFiles(scope)) {
            OptionalLong sizeOnDisk = StoredFiles.sizeIfPresent(summary.filePath());
            if (sizeOnDisk.isPresent()) {
                present.add(summary.withFileSize(sizeOnDisk.getAsLong()));
            }
        }
        return present;
    }

    @Override
    public synchronized List<FileSummary> listIndexedFiles(CollectionScope scope) {
        MemoryCollection collection = collections.get(scope.collectionName());
        if (collection == null) {
            return List.of();
        }
        Map<String, FileSummary> filesByPath = new LinkedHashMap<>();
        for (DocumentPoint point : collection.points.values()) {
            filesByPath.putIfAbsent(point.metadata().filePath(), FileSummary.fromMetadata(point.metadata()));
        }
        return new ArrayList<>(filesByPath.values());
    }

    /**
     * Returns every point currently stored in a collection.
     */
    public synchronized List<DocumentPoint> points(CollectionScope scope) {
        MemoryCollection collection = collections.get(scope.collectionName());
        return collection == null ? List.of() : List.copyOf(collection.points.values());
    }

    private static final class MemoryCollection {
        private final int vectorSize;
        private final Map<UUID, DocumentPoint> points = new LinkedHashMap<>();

        private MemoryCollection(int vectorSize) {
            this.vectorSize = vectorSize;
        }

        private CollectionInfo info(String collectionName) {
            return new CollectionInfo(collectionName, points.size(), STATUS, vectorSize, DISTANCE);
        }
    }
}
