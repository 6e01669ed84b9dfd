package com.williamcallahan.flowindex.service.extraction;

import com.williamcallahan.flowindex.domain.ingestion.FileType;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Uses the vision model's description of an uploaded image as its content.
 */
@Component
public class ImageFileExtractor implements DocumentExtractor {

    private final EmbeddedImageDescriber describer;

    public ImageFileExtractor(EmbeddedImageDescriber describer) {
        this.describer = Objects.requireNonNull(describer, "describer");
    }

    @Override
    public FileType supportedType() {
        return FileType.IMAGE;
    }

    @Override
    public String extract(Path path, boolean includeImages) throws IOException {
        return describer.describeStandalone(Files.readAllBytes(path));
    }
}
