package com.williamcallahan.flowindex.service.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.williamcallahan.flowindex.domain.ingestion.FileType;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies the probe chain order and the unknown fallback.
 */
class FileTypeDetectorTest {

    private final FileTypeDetector detector = new FileTypeDetector();

    @TempDir
    Path workDir;

    @Test
    void recognizesKnownExtensions() throws IOException {
        assertEquals(FileType.PDF, detector.detect(touch("report.PDF")));
        assertEquals(FileType.DOCX, detector.detect(touch("letter.docx")));
        assertEquals(FileType.PPTX, detector.detect(touch("deck.pptx")));
        assertEquals(FileType.XLSX, detector.detect(touch("sheet.xlsx")));
        assertEquals(FileType.IMAGE, detector.detect(touch("photo.jpeg")));
        assertEquals(FileType.TEXT, detector.detect(touch("script.py")));
    }

    @Test
    void fallsBackToUtf8ContentProbeForUnlistedExtensions() throws IOException {
        Path file = Files.writeString(workDir.resolve("notes.rst"), "Plain words with ünïcode", StandardCharsets.UTF_8);

        assertEquals(FileType.TEXT, detector.detect(file));
    }

    @Test
    void fallsBackToPdfParseWhenBytesAreNotText() throws IOException {
        Path file = workDir.resolve("scan.bin");
        try (PDDocument document = new PDDocument()) {
            document.addPage(new PDPage());
            document.save(file.toFile());
        }

        assertEquals(FileType.PDF, detector.detect(file));
    }

    @Test
    void binaryExecutableIsUnknown() throws IOException {
        byte[] peHeader = {(byte) 0x4D, (byte) 0x5A, (byte) 0xFF, (byte) 0xFE, 0, (byte) 0xFF};
        Path file = Files.write(workDir.resolve("setup.exe"), peHeader);

        assertEquals(FileType.UNKNOWN, detector.detect(file));
    }

    @Test
    void firstProbeWithAnAnswerWins() throws IOException {
        FileTypeDetector chain = new FileTypeDetector(List.of(
                path -> Optional.empty(), path -> Optional.of(FileType.XLSX), path -> Optional.of(FileType.PDF)));

        assertEquals(FileType.XLSX, chain.detect(touch("anything")));
    }

    @Test
    void extensionOfIgnoresDotfilesAndTrailingDots() {
        assertEquals("", ExtensionFileTypeProbe.extensionOf(Path.of(".bashrc")));
        assertEquals("", ExtensionFileTypeProbe.extensionOf(Path.of("name.")));
        assertEquals("gz", ExtensionFileTypeProbe.extensionOf(Path.of("archive.tar.GZ")));
    }

    private Path touch(String name) throws IOException {
        return Files.writeString(workDir.resolve(name), "x");
    }
}
