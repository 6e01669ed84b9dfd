package com.williamcallahan.flowindex.domain.ingestion;

/**
 * Independent outcomes of removing one document.
 *
 * @param vectorStoreDeleted true when at least one point was removed
 * @param pointsDeleted number of points removed
 * @param physicalFileDeleted true when the stored file was removed from disk
 */
public record FileDeletionOutcome(boolean vectorStoreDeleted, long pointsDeleted, boolean physicalFileDeleted) {

    public static FileDeletionOutcome of(long pointsDeleted, boolean physicalFileDeleted) {
        return new FileDeletionOutcome(pointsDeleted > 0, pointsDeleted, physicalFileDeleted);
    }
}
