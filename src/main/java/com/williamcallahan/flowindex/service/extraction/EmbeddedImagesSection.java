package com.williamcallahan.flowindex.service.extraction;

import java.util.List;

/**
 * Formats the image description appendix added after a document's text.
 */
final class EmbeddedImagesSection {

    static final String HEADER = "\n\n=== EMBEDDED IMAGES ===\n\n";

    private EmbeddedImagesSection() {}

    /**
     * Appends numbered entries to {@code text}; returns {@code text} unchanged when there are none.
     *
     * @param text extracted document text
     * @param entries tagged descriptions such as {@code [Image from page 2]: a chart}
     * @return text with the appendix
     */
    static String append(String text, List<String> entries) {
        if (entries.isEmpty()) {
            return text;
        }
        StringBuilder appended = new StringBuilder(text).append(HEADER);
        for (int index = 0; index < entries.size(); index++) {
            appended.append("Image ").append(index + 1).append(": ").append(entries.get(index)).append("\n\n");
        }
        return appended.toString();
    }
}
