package com.williamcallahan.flowindex.service.extraction;

import com.williamcallahan.flowindex.domain.ingestion.FileType;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Detects the type from the file name extension.
 */
public class ExtensionFileTypeProbe implements FileTypeProbe {

    private static final Map<String, FileType> OFFICE_AND_PDF = Map.of(
            "pdf", FileType.PDF,
            "pptx", FileType.PPTX,
            "xlsx", FileType.XLSX,
            "docx", FileType.DOCX);
    private static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "bmp", "tiff", "webp");
    private static final Set<String> TEXT_EXTENSIONS =
            Set.of("txt", "md", "py", "js", "html", "css", "json", "xml", "csv");

    @Override
    public Optional<FileType> probe(Path path) {
        String extension = extensionOf(path);
        if (extension.isEmpty()) {
            return Optional.empty();
        }
        FileType documentType = OFFICE_AND_PDF.get(extension);
        if (documentType != null) {
            return Optional.of(documentType);
        }
        if (IMAGE_EXTENSIONS.contains(extension)) {
            return Optional.of(FileType.IMAGE);
        }
        if (TEXT_EXTENSIONS.contains(extension)) {
            return Optional.of(FileType.TEXT);
        }
        return Optional.empty();
    }

    static String extensionOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
