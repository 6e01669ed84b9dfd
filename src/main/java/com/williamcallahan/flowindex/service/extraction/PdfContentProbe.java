package com.williamcallahan.flowindex.service.extraction;

import com.williamcallahan.flowindex.domain.ingestion.FileType;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Treats a file as PDF when PDFBox can open it.
 */
public class PdfContentProbe implements FileTypeProbe {

    private static final Logger log = LoggerFactory.getLogger(PdfContentProbe.class);

    @Override
    public Optional<FileType> probe(Path path) {
        try (PDDocument ignored = Loader.loadPDF(path.toFile())) {
            return Optional.of(FileType.PDF);
        } catch (IOException notPdf) {
            log.debug("[EXTRACT] {} is not a PDF: {}", path.getFileName(), notPdf.getMessage());
            return Optional.empty();
        }
    }
}
