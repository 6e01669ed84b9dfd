package com.williamcallahan.flowindex.service.extraction;

import com.williamcallahan.flowindex.domain.ingestion.FileType;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Treats a file as text when its leading bytes decode as UTF-8.
 */
public class Utf8ContentProbe implements FileTypeProbe {

    private static final Logger log = LoggerFactory.getLogger(Utf8ContentProbe.class);
    private static final int SAMPLE_BYTES = 4096;

    @Override
    public Optional<FileType> probe(Path path) {
        byte[] sample;
        try (InputStream in = Files.newInputStream(path)) {
            sample = in.readNBytes(SAMPLE_BYTES);
        } catch (IOException readFailure) {
            log.debug("[EXTRACT] Cannot sample {}: {}", path.getFileName(), readFailure.getMessage());
            return Optional.empty();
        }
        return isUtf8(sample, sample.length < SAMPLE_BYTES) ? Optional.of(FileType.TEXT) : Optional.empty();
    }

    static boolean isUtf8(byte[] sample, boolean endOfInput) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        CharBuffer out = CharBuffer.allocate(sample.length + 1);
        // endOfInput=false tolerates a multi-byte sequence cut at the sample boundary
        return !decoder.decode(ByteBuffer.wrap(sample), out, endOfInput).isError();
    }
}
