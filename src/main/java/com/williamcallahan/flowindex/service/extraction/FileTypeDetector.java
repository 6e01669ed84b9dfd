package com.williamcallahan.flowindex.service.extraction;

import com.williamcallahan.flowindex.domain.ingestion.FileType;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs file type probes in order and returns the first answer.
 *
 * <p>The default chain is extension, then MIME type, then a UTF-8 decode of the leading
 * bytes, then a PDF parse. A file no probe recognizes is {@link FileType#UNKNOWN}.</p>
 */
@Component
public class FileTypeDetector {

    private static final Logger log = LoggerFactory.getLogger(FileTypeDetector.class);

    private final List<FileTypeProbe> probes;

    public FileTypeDetector() {
        this(List.of(
                new ExtensionFileTypeProbe(),
                new MimeTypeFileTypeProbe(),
                new Utf8ContentProbe(),
                new PdfContentProbe()));
    }

    FileTypeDetector(List<FileTypeProbe> probes) {
        this.probes = List.copyOf(Objects.requireNonNull(probes, "probes"));
    }

    /**
     * Detects the type of a file.
     *
     * @param path file to inspect
     * @return detected type, {@link FileType#UNKNOWN} when every probe defers
     */
    public FileType detect(Path path) {
        Objects.requireNonNull(path, "path");
        for (FileTypeProbe probe : probes) {
            Optional<FileType> detected = probe.probe(path);
            if (detected.isPresent()) {
                log.debug("[EXTRACT] {} detected as {} by {}",
                        path.getFileName(), detected.get().wireName(), probe.getClass().getSimpleName());
                return detected.get();
            }
        }
        return FileType.UNKNOWN;
    }
}
