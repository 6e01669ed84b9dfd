package com.williamcallahan.flowindex.domain.ingestion;

/**
 * Point-in-time counters for the image description cache.
 *
 * @param size entries currently held
 * @param capacity maximum entries before eviction
 * @param hits lookups answered from the cache
 * @param misses lookups that found nothing
 * @param hitRatePercent hits over total lookups as a percentage, two decimals
 */
public record ImageCacheStats(int size, int capacity, long hits, long misses, double hitRatePercent) {

    /**
     * Builds stats, computing the hit rate from the raw counters.
     */
    public static ImageCacheStats of(int size, int capacity, long hits, long misses) {
        long lookups = hits + misses;
        double rate = lookups == 0 ? 0.0 : Math.round(hits * 10_000.0 / lookups) / 100.0;
        return new ImageCacheStats(size, capacity, hits, misses, rate);
    }
}
