package com.williamcallahan.flowindex.service;

import com.williamcallahan.flowindex.domain.ingestion.ImageCacheStats;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded LRU cache of vision-model descriptions keyed by the SHA-256 of the image bytes.
 *
 * <p>Identical bytes always hash to the same key, so entries never go stale and are only
 * removed by LRU eviction or {@link #clear()}. All access is serialized on one lock; callers
 * must not hold it across the vision call itself.</p>
 */
public class ImageDescriptionCache {

    private static final Logger log = LoggerFactory.getLogger(ImageDescriptionCache.class);

    private final ContentHasher hasher;
    private final int capacity;
    private final Object lock = new Object();
    private final LinkedHashMap<String, String> descriptionsByHash;
    private long hits;
    private long misses;

    /**
     * Creates an empty cache.
     *
     * @param hasher digest used to key images
     * @param capacity maximum number of descriptions held
     */
    public ImageDescriptionCache(ContentHasher hasher, int capacity) {
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.descriptionsByHash = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
                return size() > ImageDescriptionCache.this.capacity;
            }
        };
    }

    /**
     * Looks up a description and promotes the entry to most recently used on a hit.
     *
     * @param imageBytes raw image bytes
     * @return cached description, empty on a miss
     */
    public Optional<String> get(byte[] imageBytes) {
        String key = hasher.sha256(imageBytes);
        synchronized (lock) {
            String description = descriptionsByHash.get(key);
            if (description == null) {
                misses++;
                return Optional.empty();
            }
            hits++;
            log.debug("[VISION] Cache hit for image {}", abbreviate(key));
            return Optional.of(description);
        }
    }

    /**
     * Inserts or refreshes a description, evicting the least recently used entry when full.
     *
     * @param imageBytes raw image bytes
     * @param description description to cache
     */
    public void put(byte[] imageBytes, String description) {
        Objects.requireNonNull(description, "description");
        String key = hasher.sha256(imageBytes);
        synchronized (lock) {
            descriptionsByHash.put(key, description);
        }
    }

    /**
     * Drops every entry and resets the hit/miss counters.
     */
    public void clear() {
        synchronized (lock) {
            descriptionsByHash.clear();
            hits = 0;
            misses = 0;
        }
        log.info("[VISION] Image description cache cleared");
    }

    public ImageCacheStats stats() {
        synchronized (lock) {
            return ImageCacheStats.of(descriptionsByHash.size(), capacity, hits, misses);
        }
    }

    public int capacity() {
        return capacity;
    }

    private static String abbreviate(String hash) {
        return hash.length() > 12 ? hash.substring(0, 12) : hash;
    }
}
