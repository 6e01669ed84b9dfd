package com.williamcallahan.flowindex.service.extraction;

import com.williamcallahan.flowindex.domain.ingestion.ExtractedContent;
import com.williamcallahan.flowindex.domain.ingestion.FileType;
import com.williamcallahan.flowindex.service.IngestionException;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Detects a file's type and dispatches to the matching {@link DocumentExtractor}.
 */
@Service
public class ContentExtractor {

    private static final Logger log = LoggerFactory.getLogger(ContentExtractor.class);

    private final FileTypeDetector detector;
    private final Map<FileType, DocumentExtractor> extractorsByType = new EnumMap<>(FileType.class);

    public ContentExtractor(FileTypeDetector detector, List<DocumentExtractor> extractors) {
        this.detector = Objects.requireNonNull(detector, "detector");
        for (DocumentExtractor extractor : Objects.requireNonNull(extractors, "extractors")) {
            DocumentExtractor previous = extractorsByType.put(extractor.supportedType(), extractor);
            if (previous != null) {
                throw new IllegalStateException("Duplicate extractor for " + extractor.supportedType() + ": "
                        + previous.getClass().getSimpleName() + ", " + extractor.getClass().getSimpleName());
            }
        }
    }

    /**
     * Detects a file's type without reading more than a small sample.
     *
     * @param path file to inspect
     * @return detected type, possibly {@link FileType#UNKNOWN}
     */
    public FileType detectType(Path path) {
        return detector.detect(path);
    }

    /**
     * Extracts flat text from a file.
     *
     * @param path file to read
     * @param includeImages whether embedded images should be described
     * @return text and the type it was extracted as
     * @throws UnsupportedFileTypeException when the type is unknown or has no extractor
     * @throws DocumentDecodeException when the file cannot be decoded as its type
     */
    public ExtractedContent extract(Path path, boolean includeImages) {
        FileType fileType = detectType(path);
        DocumentExtractor extractor = extractorsByType.get(fileType);
        if (!fileType.isSupported() || extractor == null) {
            throw new UnsupportedFileTypeException(
                    "Unsupported file type '" + fileType.wireName() + "' for " + path.getFileName());
        }
        log.info("[EXTRACT] Extracting {} as {} (images={})", path.getFileName(), fileType.wireName(), includeImages);
        try {
            String text = extractor.extract(path, includeImages);
            log.debug("[EXTRACT] {} yielded {} characters", path.getFileName(), text.length());
            return new ExtractedContent(text, fileType);
        } catch (CharacterCodingException decodeFailure) {
            throw new DocumentDecodeException(path.getFileName() + " is not valid UTF-8 text", decodeFailure);
        } catch (IOException readFailure) {
            throw new DocumentDecodeException(
                    "Failed to extract text from " + fileType.wireName() + " file: " + readFailure.getMessage(),
                    readFailure);
        } catch (IngestionException pipelineFailure) {
            throw pipelineFailure;
        } catch (RuntimeException parseFailure) {
            throw new DocumentDecodeException(
                    "Failed to extract text from " + fileType.wireName() + " file: " + parseFailure.getMessage(),
                    parseFailure);
        }
    }
}
