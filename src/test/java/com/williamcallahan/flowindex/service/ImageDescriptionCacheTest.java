package com.williamcallahan.flowindex.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.flowindex.domain.ingestion.ImageCacheStats;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/**
 * Verifies LRU eviction, promotion on read and hit/miss accounting.
 */
class ImageDescriptionCacheTest {

    private static byte[] image(String label) {
        return label.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void returnsDescriptionStoredForIdenticalBytes() {
        ImageDescriptionCache cache = new ImageDescriptionCache(new ContentHasher(), 4);
        cache.put(image("cat"), "a cat on a sofa");

        assertEquals(Optional.of("a cat on a sofa"), cache.get(image("cat")));
    }

    @Test
    void evictsLeastRecentlyUsedEntryWhenOverCapacity() {
        ImageDescriptionCache cache = new ImageDescriptionCache(new ContentHasher(), 2);
        cache.put(image("one"), "first");
        cache.put(image("two"), "second");
        cache.get(image("one"));

        cache.put(image("three"), "third");

        assertTrue(cache.get(image("two")).isEmpty());
        assertEquals(Optional.of("first"), cache.get(image("one")));
        assertEquals(Optional.of("third"), cache.get(image("three")));
        assertEquals(2, cache.stats().size());
    }

    @Test
    void putRefreshesExistingEntryWithoutGrowing() {
        ImageDescriptionCache cache = new ImageDescriptionCache(new ContentHasher(), 2);
        cache.put(image("one"), "old");
        cache.put(image("one"), "new");

        assertEquals(Optional.of("new"), cache.get(image("one")));
        assertEquals(1, cache.stats().size());
    }

    @Test
    void statsReportHitRateAndClearResetsCounters() {
        ImageDescriptionCache cache = new ImageDescriptionCache(new ContentHasher(), 10);
        cache.put(image("a"), "desc");
        cache.get(image("a"));
        cache.get(image("a"));
        cache.get(image("missing"));

        ImageCacheStats stats = cache.stats();
        assertEquals(2, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(66.67, stats.hitRatePercent());
        assertEquals(10, stats.capacity());

        cache.clear();
        ImageCacheStats cleared = cache.stats();
        assertEquals(0, cleared.size());
        assertEquals(0, cleared.hits());
        assertEquals(0.0, cleared.hitRatePercent());
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ImageDescriptionCache(new ContentHasher(), 0));
    }
}
