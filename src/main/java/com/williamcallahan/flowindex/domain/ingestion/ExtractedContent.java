package com.williamcallahan.flowindex.domain.ingestion;

import java.util.Objects;

/**
 * Flat text produced from a document.
 *
 * @param text extracted text, possibly with an image description appendix
 * @param fileType type the text was extracted as
 */
public record ExtractedContent(String text, FileType fileType) {

    public ExtractedContent {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(fileType, "fileType");
    }
}
