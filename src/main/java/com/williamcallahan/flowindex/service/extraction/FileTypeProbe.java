package com.williamcallahan.flowindex.service.extraction;

import com.williamcallahan.flowindex.domain.ingestion.FileType;
import java.nio.file.Path;
import java.util.Optional;

/**
 * One step of file type detection.
 */
public interface FileTypeProbe {

    /**
     * Inspects a file and names its type when this probe can tell.
     *
     * @param path file to inspect
     * @return detected type, empty to defer to the next probe
     */
    Optional<FileType> probe(Path path);
}
