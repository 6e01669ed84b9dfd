package com.williamcallahan.flowindex.service.extraction;

import com.williamcallahan.flowindex.domain.ingestion.FileType;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFPictureShape;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTable;
import org.apache.poi.xslf.usermodel.XSLFTableCell;
import org.apache.poi.xslf.usermodel.XSLFTableRow;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.springframework.stereotype.Component;

/**
 * Extracts slide text and tables from PowerPoint presentations.
 *
 * <p>Each slide with content becomes a {@code === SLIDE n ===} block; slides without text are
 * left out but keep their number.</p>
 */
@Component
public class PresentationContentExtractor implements DocumentExtractor {

    static final String EMPTY_PRESENTATION = "No text content found in PowerPoint presentation.";
    private static final String CELL_SEPARATOR = " | ";

    private final EmbeddedImageDescriber describer;

    public PresentationContentExtractor(EmbeddedImageDescriber describer) {
        this.describer = Objects.requireNonNull(describer, "describer");
    }

    @Override
    public FileType supportedType() {
        return FileType.PPTX;
    }

    @Override
    public String extract(Path path, boolean includeImages) throws IOException {
        try (InputStream in = Files.newInputStream(path);
                XMLSlideShow slideShow = new XMLSlideShow(in)) {
            List<String> lines = new ArrayList<>();
            List<String> imageEntries = new ArrayList<>();
            int slideNumber = 0;
            for (XSLFSlide slide : slideShow.getSlides()) {
                slideNumber++;
                List<String> slideLines = new ArrayList<>();
                collectShapes(slide.getShapes(), slideLines);
                if (!slideLines.isEmpty()) {
                    lines.add("=== SLIDE " + slideNumber + " ===");
                    lines.addAll(slideLines);
                    lines.add("");
                }
                if (includeImages) {
                    describePictures(slide.getShapes(), slideNumber, imageEntries);
                }
            }

            String result = EmbeddedImagesSection.append(String.join("\n", lines), imageEntries);
            return result.isBlank() ? EMPTY_PRESENTATION : result;
        }
    }

    private static void collectShapes(List<XSLFShape> shapes, List<String> slideLines) {
        for (XSLFShape shape : shapes) {
            if (shape instanceof XSLFTextShape textShape) {
                String text = textShape.getText() == null ? "" : textShape.getText().strip();
                if (!text.isEmpty()) {
                    slideLines.add(text);
                }
            } else if (shape instanceof XSLFTable table) {
                List<String> rows = linearize(table);
                if (!rows.isEmpty()) {
                    slideLines.add("TABLE:");
                    slideLines.addAll(rows);
                }
            } else if (shape instanceof XSLFGroupShape group) {
                collectShapes(group.getShapes(), slideLines);
            }
        }
    }

    private static List<String> linearize(XSLFTable table) {
        List<String> rows = new ArrayList<>();
        for (XSLFTableRow row : table.getRows()) {
            List<String> cells = new ArrayList<>();
            for (XSLFTableCell cell : row.getCells()) {
                String cellText = cell.getText() == null ? "" : cell.getText().strip();
                if (!cellText.isEmpty()) {
                    cells.add(cellText);
                }
            }
            if (!cells.isEmpty()) {
                rows.add(String.join(CELL_SEPARATOR, cells));
            }
        }
        return rows;
    }

    private void describePictures(List<XSLFShape> shapes, int slideNumber, List<String> imageEntries) {
        for (XSLFShape shape : shapes) {
            if (shape instanceof XSLFPictureShape picture && picture.getPictureData() != null) {
                byte[] imageBytes = picture.getPictureData().getData();
                imageEntries.add("[Image from slide " + slideNumber + "]: " + describer.describeEmbedded(imageBytes));
            } else if (shape instanceof XSLFGroupShape group) {
                describePictures(group.getShapes(), slideNumber, imageEntries);
            }
        }
    }
}
