package com.williamcallahan.flowindex.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies sliding-window chunk boundaries and window validation.
 */
class ChunkerTest {

    private final Chunker chunker = new Chunker();

    @Test
    void splitsTwentyFiveHundredCharactersIntoFourOverlappingWindows() {
        String text = sequentialText(2_500);

        List<String> chunks = chunker.chunk(text, 1_000, 200);

        assertEquals(4, chunks.size());
        assertEquals(text.substring(0, 1_000), chunks.get(0));
        assertEquals(text.substring(800, 1_800), chunks.get(1));
        assertEquals(text.substring(1_600, 2_500), chunks.get(2));
        assertEquals(text.substring(2_400), chunks.get(3));
        assertEquals(100, chunks.get(3).length());
    }

    @Test
    void strideSlicesReconstructTheOriginalText() {
        String text = sequentialText(3_337);
        int chunkSize = 250;
        int overlap = 40;

        List<String> chunks = chunker.chunk(text, chunkSize, overlap);

        StringBuilder rebuilt = new StringBuilder();
        for (int index = 0; index < chunks.size(); index++) {
            String chunk = chunks.get(index);
            boolean last = index == chunks.size() - 1;
            rebuilt.append(last ? chunk : chunk.substring(0, chunkSize - overlap));
        }
        assertEquals(text, rebuilt.toString());
    }

    @Test
    void emptyTextYieldsNoChunks() {
        assertTrue(chunker.chunk("", 100, 10).isEmpty());
    }

    @Test
    void textShorterThanWindowYieldsOneChunk() {
        assertEquals(List.of("short"), chunker.chunk("short", 100, 10));
    }

    @Test
    void rejectsOverlapNotSmallerThanSize() {
        assertThrows(IllegalArgumentException.class, () -> chunker.chunk("abc", 100, 100));
        assertThrows(IllegalArgumentException.class, () -> chunker.chunk("abc", 100, 150));
    }

    @Test
    void rejectsNonPositiveSizeAndNegativeOverlap() {
        assertThrows(IllegalArgumentException.class, () -> Chunker.validateWindow(0, 0));
        assertThrows(IllegalArgumentException.class, () -> Chunker.validateWindow(10, -1));
    }

    private static String sequentialText(int length) {
        StringBuilder builder = new StringBuilder(length);
        for (int index = 0; index < length; index++) {
            builder.append((char) ('a' + index % 26));
        }
        return builder.toString();
    }
}
