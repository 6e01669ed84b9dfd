package com.williamcallahan.flowindex.service.extraction;

import com.williamcallahan.flowindex.domain.ingestion.FileType;
import com.williamcallahan.flowindex.service.ContentHasher;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFPictureData;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts body paragraphs and linearized tables from Word documents.
 */
@Component
public class WordDocumentExtractor implements DocumentExtractor {

    private static final Logger log = LoggerFactory.getLogger(WordDocumentExtractor.class);
    static final String EMPTY_DOCUMENT = "No text content found in Word document.";
    private static final String TABLE_HEADER = "=== TABLE ===";
    private static final String CELL_SEPARATOR = " | ";

    private final EmbeddedImageDescriber describer;
    private final ContentHasher hasher;

    public WordDocumentExtractor(EmbeddedImageDescriber describer, ContentHasher hasher) {
        this.describer = Objects.requireNonNull(describer, "describer");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
    }

    @Override
    public FileType supportedType() {
        return FileType.DOCX;
    }

    @Override
    public String extract(Path path, boolean includeImages) throws IOException {
        try (InputStream in = Files.newInputStream(path);
                XWPFDocument document = new XWPFDocument(in)) {
            List<String> lines = new ArrayList<>();
            for (XWPFParagraph paragraph : document.getParagraphs()) {
                String text = paragraph.getText().strip();
                if (!text.isEmpty()) {
                    lines.add(text);
                }
            }
            for (XWPFTable table : document.getTables()) {
                List<String> tableLines = new ArrayList<>();
                for (XWPFTableRow row : table.getRows()) {
                    List<String> cells = new ArrayList<>();
                    for (XWPFTableCell cell : row.getTableCells()) {
                        String cellText = cell.getText().strip();
                        if (!cellText.isEmpty()) {
                            cells.add(cellText);
                        }
                    }
                    if (!cells.isEmpty()) {
                        tableLines.add(String.join(CELL_SEPARATOR, cells));
                    }
                }
                if (!tableLines.isEmpty()) {
                    lines.add(TABLE_HEADER);
                    lines.addAll(tableLines);
                    lines.add("");
                }
            }

            String result = String.join("\n", lines);
            if (includeImages) {
                result = EmbeddedImagesSection.append(result, describeImages(document));
            }
            return result.isBlank() ? EMPTY_DOCUMENT : result;
        }
    }

    private List<String> describeImages(XWPFDocument document) {
        List<String> entries = new ArrayList<>();
        Set<String> seenHashes = new HashSet<>();
        for (XWPFPictureData picture : document.getAllPackagePictures()) {
            if (!OfficeImageFilter.isDescribableWordImage(picture.suggestFileExtension())) {
                continue;
            }
            byte[] imageBytes = picture.getData();
            if (!seenHashes.add(hasher.sha256(imageBytes))) {
                log.debug("[EXTRACT] Skipping duplicate Word image {}", picture.getFileName());
                continue;
            }
            entries.add("[Word embedded image]: " + describer.describeEmbedded(imageBytes));
        }
        return entries;
    }
}
