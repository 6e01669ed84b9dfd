package com.williamcallahan.flowindex.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.flowindex.domain.ingestion.ProcessingEntry;
import com.williamcallahan.flowindex.domain.ingestion.ProcessingStatus;
import com.williamcallahan.flowindex.domain.ingestion.ProcessingUpdate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies tracker lifecycle, partial updates, flow filtering and stale cleanup.
 */
class ProcessingTrackerTest {

    private static final Instant START = Instant.parse("2025-03-01T10:00:00Z");

    @Test
    void addedEntryIsProcessingUntilRemoved() {
        ProcessingTracker tracker = new ProcessingTracker(Clock.fixed(START, ZoneOffset.UTC));
        ProcessingEntry entry = tracker.add("file-1", "flow-a", "flow-a", "notes.txt");

        assertEquals(ProcessingStatus.PROCESSING, entry.status());
        assertTrue(tracker.isProcessing("file-1"));

        tracker.remove("file-1");
        assertFalse(tracker.isProcessing("file-1"));
        assertTrue(tracker.get("file-1").isEmpty());
    }

    @Test
    void updateMergesOnlyProvidedFieldsAndStampsLastUpdated() {
        MutableClock clock = new MutableClock(START);
        ProcessingTracker tracker = new ProcessingTracker(clock);
        tracker.add("file-1", "flow-a", "flow-a", "notes.txt");
        tracker.update("file-1", ProcessingUpdate.status(ProcessingStatus.GENERATING_EMBEDDINGS).withTotalChunks(12));

        clock.advance(Duration.ofSeconds(5));
        ProcessingEntry merged = tracker.update("file-1", ProcessingUpdate.empty().withCurrentChunk(6))
                .orElseThrow();

        assertEquals(ProcessingStatus.GENERATING_EMBEDDINGS, merged.status());
        assertEquals(12, merged.totalChunks());
        assertEquals(6, merged.currentChunk());
        assertEquals(START, merged.startedAt());
        assertEquals(START.plusSeconds(5), merged.lastUpdated());
    }

    @Test
    void updateOfUnknownFileIsEmpty() {
        ProcessingTracker tracker = new ProcessingTracker(Clock.systemUTC());
        assertTrue(tracker.update("nope", ProcessingUpdate.failed("boom")).isEmpty());
    }

    @Test
    void failedEntryKeepsErrorUntilRemoved() {
        ProcessingTracker tracker = new ProcessingTracker(Clock.systemUTC());
        tracker.add("file-1", "flow-a", "flow-a", "notes.txt");
        tracker.update("file-1", ProcessingUpdate.failed("DocumentDecodeException: bad bytes"));

        ProcessingEntry entry = tracker.get("file-1").orElseThrow();
        assertEquals(ProcessingStatus.FAILED, entry.status());
        assertEquals("DocumentDecodeException: bad bytes", entry.optionalError().orElseThrow());
        assertTrue(tracker.isProcessing("file-1"));
    }

    @Test
    void getByFlowReturnsOnlyThatFlowOldestFirst() {
        MutableClock clock = new MutableClock(START);
        ProcessingTracker tracker = new ProcessingTracker(clock);
        tracker.add("late", "flow-a", "flow-a", "b.txt");
        clock.advance(Duration.ofMinutes(-10));
        tracker.add("early", "flow-a", "flow-a", "a.txt");
        tracker.add("other", "flow-b", "flow-b", "c.txt");

        List<ProcessingEntry> entries = tracker.getByFlow("flow-a");

        assertEquals(List.of("early", "late"), entries.stream().map(ProcessingEntry::fileId).toList());
    }

    @Test
    void cleanupStaleRemovesOnlyEntriesOlderThanMaxAge() {
        MutableClock clock = new MutableClock(START);
        ProcessingTracker tracker = new ProcessingTracker(clock);
        tracker.add("old", "flow-a", "flow-a", "old.txt");
        clock.advance(Duration.ofHours(23));
        tracker.add("recent", "flow-a", "flow-a", "recent.txt");
        clock.advance(Duration.ofHours(2));

        int removed = tracker.cleanupStale(Duration.ofHours(24));

        assertEquals(1, removed);
        assertFalse(tracker.isProcessing("old"));
        assertTrue(tracker.isProcessing("recent"));
        assertEquals(1, tracker.size());
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
