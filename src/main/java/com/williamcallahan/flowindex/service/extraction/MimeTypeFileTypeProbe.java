package com.williamcallahan.flowindex.service.extraction;

import com.williamcallahan.flowindex.domain.ingestion.FileType;
import java.io.IOException;
import java.net.URLConnection;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects the type from the MIME type guessed for the file name.
 */
public class MimeTypeFileTypeProbe implements FileTypeProbe {

    private static final Logger log = LoggerFactory.getLogger(MimeTypeFileTypeProbe.class);

    private static final Map<String, FileType> MIME_TYPES = Map.of(
            "application/pdf", FileType.PDF,
            "application/vnd.openxmlformats-officedocument.presentationml.presentation", FileType.PPTX,
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", FileType.XLSX,
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document", FileType.DOCX);

    @Override
    public Optional<FileType> probe(Path path) {
        String mimeType = guessMimeType(path);
        if (mimeType == null) {
            return Optional.empty();
        }
        FileType documentType = MIME_TYPES.get(mimeType);
        if (documentType != null) {
            return Optional.of(documentType);
        }
        if (mimeType.startsWith("text/")) {
            return Optional.of(FileType.TEXT);
        }
        return Optional.empty();
    }

    private static String guessMimeType(Path path) {
        Path fileName = path.getFileName();
        if (fileName != null) {
            String fromName = URLConnection.guessContentTypeFromName(fileName.toString());
            if (fromName != null) {
                return fromName;
            }
        }
        try {
            return Files.probeContentType(path);
        } catch (IOException probeFailure) {
            log.debug("[EXTRACT] MIME probe failed for {}: {}", fileName, probeFailure.getMessage());
            return null;
        }
    }
}
