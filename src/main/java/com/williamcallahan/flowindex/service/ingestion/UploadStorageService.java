package com.williamcallahan.flowindex.service.ingestion;

import com.williamcallahan.flowindex.config.AppProperties;
import com.williamcallahan.flowindex.domain.ingestion.CollectionScope;
import com.williamcallahan.flowindex.domain.ingestion.StoredUpload;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes uploads under {@code <upload-dir>/<collection>/<fileId>_<fileName>} and removes them
 * once ingestion finishes.
 */
@Service
public class UploadStorageService {

    private static final Logger log = LoggerFactory.getLogger(UploadStorageService.class);
    private static final char ID_SEPARATOR = '_';

    private final Path uploadRoot;

    public UploadStorageService(AppProperties appProperties) {
        Objects.requireNonNull(appProperties, "appProperties");
        this.uploadRoot = Path.of(appProperties.getIngestion().getUploadDir()).toAbsolutePath().normalize();
    }

    public Path uploadRoot() {
        return uploadRoot;
    }

    /**
     * Copies an upload stream to a fresh file in the scope's directory.
     *
     * @param scope collection scope that owns the upload
     * @param fileName original file name, without directories
     * @param content upload bytes; not closed by this method
     * @return the stored upload with its generated file id
     * @throws IllegalArgumentException when the file name is blank or carries path elements
     * @throws UncheckedIOException when the file cannot be written
     */
    public StoredUpload store(CollectionScope scope, String fileName, InputStream content) {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(content, "content");
        validateFileName(fileName);

        String fileId = UUID.randomUUID().toString();
        Path directory = resolveUnderRoot(Path.of(scope.collectionName()));
        Path target = resolveUnderRoot(directory.resolve(fileId + ID_SEPARATOR + fileName));
        try {
            Files.createDirectories(directory);
            long written = Files.copy(content, target);
            log.info("[UPLOAD] Stored {} ({} bytes) as {}", fileName, written, target.getFileName());
            return new StoredUpload(fileId, fileName, target, written);
        } catch (IOException writeFailure) {
            deleteQuietly(target);
            throw new UncheckedIOException("Failed to save file: " + writeFailure.getMessage(), writeFailure);
        }
    }

    /**
     * Deletes a stored upload if it lies under the upload root.
     *
     * @param storedPath path previously returned by {@link #store}
     * @return true when a file was removed
     */
    public boolean deleteQuietly(Path storedPath) {
        if (storedPath == null) {
            return false;
        }
        Path normalized = storedPath.toAbsolutePath().normalize();
        if (!normalized.startsWith(uploadRoot)) {
            log.warn("[UPLOAD] Refusing to delete {} outside upload root", normalized);
            return false;
        }
        try {
            return Files.deleteIfExists(normalized);
        } catch (IOException deleteFailure) {
            log.warn("[UPLOAD] Could not delete {}: {}", normalized, deleteFailure.getMessage());
            return false;
        }
    }

    private Path resolveUnderRoot(Path relativeOrAbsolute) {
        Path resolved = uploadRoot.resolve(relativeOrAbsolute).normalize();
        if (!resolved.startsWith(uploadRoot) || resolved.equals(uploadRoot)) {
            throw new IllegalArgumentException("Upload path escapes the upload directory: " + relativeOrAbsolute);
        }
        return resolved;
    }

    private static void validateFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("No filename provided");
        }
        if (fileName.indexOf('/') >= 0 || fileName.indexOf('\\') >= 0 || fileName.equals("..")
                || fileName.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Filename must not contain path elements: " + fileName);
        }
    }
}
