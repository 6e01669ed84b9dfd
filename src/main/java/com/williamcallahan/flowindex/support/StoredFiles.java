package com.williamcallahan.flowindex.support;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks whether paths recorded in vector store metadata still exist on disk.
 */
public final class StoredFiles {

    private static final Logger log = LoggerFactory.getLogger(StoredFiles.class);

    private StoredFiles() {}

    /**
     * Returns the size of a regular file, or empty when the path is gone, invalid or unreadable.
     *
     * @param filePath path string as stored in metadata
     * @return file size when present
     */
    public static OptionalLong sizeIfPresent(String filePath) {
        if (filePath == null || filePath.isBlank()) {
            return OptionalLong.empty();
        }
        try {
            Path path = Path.of(filePath);
            if (!Files.isRegularFile(path)) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(Files.size(path));
        } catch (InvalidPathException | IOException exception) {
            log.debug("Stored file {} is not readable: {}", filePath, exception.getMessage());
            return OptionalLong.empty();
        }
    }
}
