package com.williamcallahan.flowindex.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Splits text into overlapping fixed-size character windows.
 */
@Component
public class Chunker {

    /**
     * Produces windows starting at {@code 0, stride, 2*stride, ...} where {@code stride = chunkSize - chunkOverlap}.
     *
     * <p>Each window holds at most {@code chunkSize} characters; the last one may be shorter.
     * Empty windows are dropped.</p>
     *
     * @param text text to split
     * @param chunkSize maximum window length, must be positive
     * @param chunkOverlap characters shared with the previous window, in {@code [0, chunkSize)}
     * @return windows in document order
     * @throws IllegalArgumentException when the parameters would give a non-positive stride
     */
    public List<String> chunk(String text, int chunkSize, int chunkOverlap) {
        Objects.requireNonNull(text, "text");
        validateWindow(chunkSize, chunkOverlap);
        int stride = chunkSize - chunkOverlap;
        List<String> chunks = new ArrayList<>();
        for (int start = 0; start < text.length(); start += stride) {
            int end = Math.min(start + chunkSize, text.length());
            String window = text.substring(start, end);
            if (!window.isEmpty()) {
                chunks.add(window);
            }
        }
        return chunks;
    }

    /**
     * Rejects chunk parameters that cannot make progress.
     *
     * @param chunkSize window length
     * @param chunkOverlap window overlap
     */
    public static void validateWindow(int chunkSize, int chunkOverlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, got " + chunkSize);
        }
        if (chunkOverlap < 0) {
            throw new IllegalArgumentException("chunkOverlap must not be negative, got " + chunkOverlap);
        }
        if (chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "chunkOverlap (" + chunkOverlap + ") must be smaller than chunkSize (" + chunkSize + ")");
        }
    }
}
