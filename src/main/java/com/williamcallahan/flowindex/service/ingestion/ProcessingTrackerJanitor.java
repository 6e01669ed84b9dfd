package com.williamcallahan.flowindex.service.ingestion;

import com.williamcallahan.flowindex.config.AppProperties;
import com.williamcallahan.flowindex.service.ProcessingTracker;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops tracker entries for jobs that never reached a terminal state.
 */
@Component
public class ProcessingTrackerJanitor {

    private static final Logger log = LoggerFactory.getLogger(ProcessingTrackerJanitor.class);

    private final ProcessingTracker tracker;
    private final Duration maxAge;

    public ProcessingTrackerJanitor(ProcessingTracker tracker, AppProperties appProperties) {
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.maxAge = Objects.requireNonNull(appProperties, "appProperties").getIngestion().getStaleEntryMaxAge();
    }

    @Scheduled(
            fixedDelayString = "${app.ingestion.stale-sweep-interval:PT1H}",
            initialDelayString = "${app.ingestion.stale-sweep-interval:PT1H}")
    public void sweepStaleEntries() {
        int removed = tracker.cleanupStale(maxAge);
        log.debug("[TRACKER] Stale sweep removed {} entries; {} remain", removed, tracker.size());
    }
}
