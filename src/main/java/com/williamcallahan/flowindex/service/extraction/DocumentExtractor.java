package com.williamcallahan.flowindex.service.extraction;

import com.williamcallahan.flowindex.domain.ingestion.FileType;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Produces flat text for one file type.
 */
public interface DocumentExtractor {

    FileType supportedType();

    /**
     * Extracts text from a file already detected as {@link #supportedType()}.
     *
     * @param path file to read
     * @param includeImages whether embedded images should be described and appended
     * @return extracted text
     * @throws IOException if the file cannot be read or parsed
     */
    String extract(Path path, boolean includeImages) throws IOException;
}
