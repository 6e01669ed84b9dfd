package com.williamcallahan.flowindex.domain.ingestion;

import java.util.Locale;

/**
 * Detected kind of an uploaded document.
 */
public enum FileType {
    TEXT("text"),
    PDF("pdf"),
    PPTX("pptx"),
    XLSX("xlsx"),
    DOCX("docx"),
    IMAGE("image"),
    UNKNOWN("unknown");

    private final String wireName;

    FileType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the lowercase label stored in point metadata.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Returns true when a content extractor exists for this type.
     */
    public boolean isSupported() {
        return this != UNKNOWN;
    }

    /**
     * Resolves a stored label back to a type; unrecognized labels map to {@link #UNKNOWN}.
     *
     * @param wireName label as stored in metadata
     * @return matching type
     */
    public static FileType fromWireName(String wireName) {
        if (wireName == null) {
            return UNKNOWN;
        }
        String normalized = wireName.trim().toLowerCase(Locale.ROOT);
        for (FileType candidate : values()) {
            if (candidate.wireName.equals(normalized)) {
                return candidate;
            }
        }
        return UNKNOWN;
    }
}
