package com.williamcallahan.flowindex.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.flowindex.config.AppProperties;
import com.williamcallahan.flowindex.service.ProcessingTracker;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class ProcessingTrackerJanitorTest {

    @Test
    void sweepDropsEntriesOlderThanConfiguredAge() {
        SteppingClock clock = new SteppingClock(Instant.parse("2025-03-02T00:00:00Z"));
        ProcessingTracker tracker = new ProcessingTracker(clock);
        tracker.add("old", "flow-1", "flow-1", "old.txt");
        clock.now = clock.now.plus(Duration.ofHours(3));
        tracker.add("fresh", "flow-1", "flow-1", "fresh.txt");

        AppProperties appProperties = new AppProperties();
        appProperties.getIngestion().setStaleEntryMaxAge(Duration.ofHours(2));
        new ProcessingTrackerJanitor(tracker, appProperties).sweepStaleEntries();

        assertEquals(1, tracker.size());
        assertFalse(tracker.isProcessing("old"));
        assertTrue(tracker.isProcessing("fresh"));
    }

    private static final class SteppingClock extends Clock {
        private Instant now;

        private SteppingClock(Instant start) {
            this.now = start;
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
