package com.williamcallahan.flowindex.service;

import com.williamcallahan.flowindex.domain.ingestion.ProcessingEntry;
import com.williamcallahan.flowindex.domain.ingestion.ProcessingUpdate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory registry of ingestion jobs keyed by file id.
 *
 * <p>Every operation takes the same lock and does only map work under it. Entries are removed
 * when a job succeeds; failed entries stay visible until {@link #remove(String)} or
 * {@link #cleanupStale(Duration)} drops them. Nothing survives a restart.</p>
 */
public class ProcessingTracker {

    private static final Logger log = LoggerFactory.getLogger(ProcessingTracker.class);

    private final Clock clock;
    private final Object lock = new Object();
    private final Map<String, ProcessingEntry> entriesByFileId = new HashMap<>();

    public ProcessingTracker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Registers a newly accepted job, replacing any previous entry with the same file id.
     *
     * @return the registered entry
     */
    public ProcessingEntry add(String fileId, String flowId, String collectionName, String fileName) {
        Objects.requireNonNull(fileId, "fileId");
        ProcessingEntry entry = ProcessingEntry.accepted(fileId, flowId, collectionName, fileName, clock.instant());
        synchronized (lock) {
            entriesByFileId.put(fileId, entry);
        }
        log.debug("[TRACKER] Registered {} for flow {}", fileId, flowId);
        return entry;
    }

    /**
     * Merges partial fields into an existing entry and stamps {@code lastUpdated}.
     *
     * @return the merged entry, empty if the file id is not tracked
     */
    public Optional<ProcessingEntry> update(String fileId, ProcessingUpdate update) {
        Objects.requireNonNull(update, "update");
        Instant now = clock.instant();
        synchronized (lock) {
            ProcessingEntry current = entriesByFileId.get(fileId);
            if (current == null) {
                return Optional.empty();
            }
            ProcessingEntry merged = current.merge(update, now);
            entriesByFileId.put(fileId, merged);
            return Optional.of(merged);
        }
    }

    public Optional<ProcessingEntry> remove(String fileId) {
        synchronized (lock) {
            return Optional.ofNullable(entriesByFileId.remove(fileId));
        }
    }

    public Optional<ProcessingEntry> get(String fileId) {
        synchronized (lock) {
            return Optional.ofNullable(entriesByFileId.get(fileId));
        }
    }

    /**
     * Returns entries belonging to one flow, oldest first.
     */
    public List<ProcessingEntry> getByFlow(String flowId) {
        List<ProcessingEntry> matches = new ArrayList<>();
        synchronized (lock) {
            for (ProcessingEntry entry : entriesByFileId.values()) {
                if (entry.flowId().equals(flowId)) {
                    matches.add(entry);
                }
            }
        }
        matches.sort(Comparator.comparing(ProcessingEntry::startedAt));
        return matches;
    }

    public boolean isProcessing(String fileId) {
        synchronized (lock) {
            return entriesByFileId.containsKey(fileId);
        }
    }

    /**
     * Removes entries whose {@code startedAt} is older than {@code now - maxAge}.
     *
     * @param maxAge retention window
     * @return number of entries removed
     */
    public int cleanupStale(Duration maxAge) {
        Objects.requireNonNull(maxAge, "maxAge");
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        synchronized (lock) {
            Iterator<ProcessingEntry> iterator = entriesByFileId.values().iterator();
            while (iterator.hasNext()) {
                if (iterator.next().startedAt().isBefore(cutoff)) {
                    iterator.remove();
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.info("[TRACKER] Removed {} stale entries older than {}", removed, maxAge);
        }
        return removed;
    }

    public int size() {
        synchronized (lock) {
            return entriesByFileId.size();
        }
    }
}
