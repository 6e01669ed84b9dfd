package com.williamcallahan.flowindex.domain.ingestion;

import java.util.Objects;

/**
 * Result of an idempotent collection create.
 *
 * @param info collection state after the call
 * @param created false when the collection already existed and was left untouched
 */
public record CollectionCreation(CollectionInfo info, boolean created) {

    public CollectionCreation {
        Objects.requireNonNull(info, "info");
    }
}
