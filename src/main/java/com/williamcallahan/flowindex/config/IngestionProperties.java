package com.williamcallahan.flowindex.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Upload storage, chunking defaults, worker pool and tracker retention settings.
 */
public class IngestionProperties {

    private static final String UPLOAD_DIR_DEF = "data/uploads";
    private static final int CHUNK_SIZE_DEF = 1_000;
    private static final int CHUNK_OVERLAP_DEF = 200;
    private static final int WORKER_THREADS_DEF = 4;
    private static final int QUEUE_CAPACITY_DEF = 100;
    private static final int IMAGE_CACHE_CAPACITY_DEF = 1_000;
    private static final Duration STALE_ENTRY_MAX_AGE_DEF = Duration.ofHours(24);
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private String uploadDir = UPLOAD_DIR_DEF;
    private int chunkSize = CHUNK_SIZE_DEF;
    private int chunkOverlap = CHUNK_OVERLAP_DEF;
    private boolean includeImages = true;
    private int workerThreads = WORKER_THREADS_DEF;
    private int queueCapacity = QUEUE_CAPACITY_DEF;
    private int imageCacheCapacity = IMAGE_CACHE_CAPACITY_DEF;
    private Duration staleEntryMaxAge = STALE_ENTRY_MAX_AGE_DEF;

    public IngestionProperties() {}

    /**
     * Validates ingestion settings, including the default chunk window.
     */
    public void validateConfiguration() {
        if (uploadDir == null || uploadDir.isBlank()) {
            throw new IllegalStateException("app.ingestion.upload-dir must not be blank.");
        }
        requirePositive("app.ingestion.chunk-size", chunkSize);
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "app.ingestion.chunk-overlap must be in [0, chunk-size); got " + chunkOverlap);
        }
        requirePositive("app.ingestion.worker-threads", workerThreads);
        requirePositive("app.ingestion.queue-capacity", queueCapacity);
        requirePositive("app.ingestion.image-cache-capacity", imageCacheCapacity);
        if (staleEntryMaxAge == null || staleEntryMaxAge.isZero() || staleEntryMaxAge.isNegative()) {
            throw new IllegalArgumentException("app.ingestion.stale-entry-max-age must be a positive duration.");
        }
    }

    public String getUploadDir() { return uploadDir; }
    public void setUploadDir(String uploadDir) { this.uploadDir = uploadDir; }

    public int getChunkSize() { return chunkSize; }
    public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }

    public int getChunkOverlap() { return chunkOverlap; }
    public void setChunkOverlap(int chunkOverlap) { this.chunkOverlap = chunkOverlap; }

    public boolean isIncludeImages() { return includeImages; }
    public void setIncludeImages(boolean includeImages) { this.includeImages = includeImages; }

    public int getWorkerThreads() { return workerThreads; }
    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

    public int getQueueCapacity() { return queueCapacity; }
    public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }

    public int getImageCacheCapacity() { return imageCacheCapacity; }
    public void setImageCacheCapacity(int imageCacheCapacity) { this.imageCacheCapacity = imageCacheCapacity; }

    public Duration getStaleEntryMaxAge() { return staleEntryMaxAge; }
    public void setStaleEntryMaxAge(Duration staleEntryMaxAge) { this.staleEntryMaxAge = staleEntryMaxAge; }

    private static void requirePositive(String propertyKey, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, propertyKey));
        }
    }
}
