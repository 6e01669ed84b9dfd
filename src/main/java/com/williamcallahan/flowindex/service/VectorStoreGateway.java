package com.williamcallahan.flowindex.service;

import com.williamcallahan.flowindex.domain.ingestion.CollectionCreation;
import com.williamcallahan.flowindex.domain.ingestion.CollectionInfo;
import com.williamcallahan.flowindex.domain.ingestion.CollectionScope;
import com.williamcallahan.flowindex.domain.ingestion.DocumentPoint;
import com.williamcallahan.flowindex.domain.ingestion.FileSummary;
import java.util.List;
import java.util.Optional;

/**
 * Collection lifecycle and per-document point operations against the vector store.
 *
 * <p>Per-document operations match on the {@code metadata.file_path} payload field.</p>
 */
public interface VectorStoreGateway {

    boolean collectionExists(CollectionScope scope);

    /**
     * Creates a cosine collection, or returns the existing one untouched.
     *
     * @param scope collection scope
     * @param vectorSize dimensionality of vectors the collection will accept
     * @return collection state and whether it was created by this call
     */
    CollectionCreation createCollection(CollectionScope scope, int vectorSize);

    /**
     * Deletes a collection; deleting an absent collection succeeds.
     *
     * @return true when a collection was actually removed
     */
    boolean deleteCollection(CollectionScope scope);

    Optional<CollectionInfo> collectionInfo(CollectionScope scope);

    boolean fileExists(CollectionScope scope, String filePath);

    /**
     * Writes points in batches.
     *
     * @throws CollectionNotFoundException when the collection is absent
     * @throws VectorDimensionMismatchException when a vector does not fit the collection
     * @throws VectorStoreException when a batch is rejected
     */
    void upsertPoints(CollectionScope scope, List<DocumentPoint> points);

    /**
     * Removes every point of one document, page by page.
     *
     * @return number of points removed, 0 when none matched
     */
    long deleteByFilePath(CollectionScope scope, String filePath);

    /**
     * Lists distinct documents whose stored file still exists on disk.
     *
     * <p>Documents whose backing file vanished are left out of the result, not removed.</p>
     */
    List<FileSummary> listFiles(CollectionScope scope);

    /**
     * Lists distinct documents by their point metadata, without consulting disk.
     */
    List<FileSummary> listIndexedFiles(CollectionScope scope);
}
