package com.williamcallahan.flowindex.service.extraction;

import com.williamcallahan.flowindex.domain.ingestion.FileType;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.stereotype.Component;

/**
 * Reads text files as strict UTF-8; invalid byte sequences surface as
 * {@link java.nio.charset.MalformedInputException}.
 */
@Component
public class PlainTextExtractor implements DocumentExtractor {

    @Override
    public FileType supportedType() {
        return FileType.TEXT;
    }

    @Override
    public String extract(Path path, boolean includeImages) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }
}
