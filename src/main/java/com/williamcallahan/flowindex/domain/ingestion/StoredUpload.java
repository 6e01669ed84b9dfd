package com.williamcallahan.flowindex.domain.ingestion;

import java.nio.file.Path;
import java.util.Objects;

/**
 * An upload written to durable storage, awaiting ingestion.
 *
 * @param fileId generated id, also the stored name prefix
 * @param fileName original file name
 * @param path stored location
 * @param size bytes written
 */
public record StoredUpload(String fileId, String fileName, Path path, long size) {

    public StoredUpload {
        Objects.requireNonNull(fileId, "fileId");
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(path, "path");
    }
}
