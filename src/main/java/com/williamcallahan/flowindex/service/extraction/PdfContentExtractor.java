package com.williamcallahan.flowindex.service.extraction;

import com.williamcallahan.flowindex.domain.ingestion.FileType;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import javax.imageio.ImageIO;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts per-page text from PDF documents using Apache PDFBox, optionally followed by
 * descriptions of the raster images placed on each page, including those nested in form XObjects.
 */
@Component
public class PdfContentExtractor implements DocumentExtractor {
    private static final Logger log = LoggerFactory.getLogger(PdfContentExtractor.class);
    private static final String PAGE_SEPARATOR = "\n\n";

    private final EmbeddedImageDescriber describer;

    public PdfContentExtractor(EmbeddedImageDescriber describer) {
        this.describer = Objects.requireNonNull(describer, "describer");
    }

    @Override
    public FileType supportedType() {
        return FileType.PDF;
    }

    @Override
    public String extract(Path pdfPath, boolean includeImages) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdfPath.toFile())) {
            StringBuilder text = new StringBuilder();
            for (String pageText : extractPageTexts(document)) {
                text.append(pageText).append(PAGE_SEPARATOR);
            }
            log.info("[EXTRACT] Extracted {} characters from {} PDF pages", text.length(), document.getNumberOfPages());
            if (!includeImages) {
                return text.toString();
            }
            return EmbeddedImagesSection.append(text.toString(), describePageImages(document));
        }
    }

    /**
     * Extracts text per page as a list where index 0 == page 1.
     */
    List<String> extractPageTexts(PDDocument document) throws IOException {
        List<String> pages = new ArrayList<>(document.getNumberOfPages());
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setSortByPosition(true);
        for (int pageNumber = 1; pageNumber <= document.getNumberOfPages(); pageNumber++) {
            stripper.setStartPage(pageNumber);
            stripper.setEndPage(pageNumber);
            pages.add(stripper.getText(document));
        }
        return pages;
    }

    private List<String> describePageImages(PDDocument document) {
        List<String> entries = new ArrayList<>();
        int pageNumber = 0;
        for (PDPage page : document.getPages()) {
            pageNumber++;
            Set<COSBase> visitedForms = Collections.newSetFromMap(new IdentityHashMap<>());
            describeImages(page.getResources(), pageNumber, entries, visitedForms);
        }
        return entries;
    }

    /**
     * Walks image XObjects in {@code resources}, descending into form XObjects once each.
     */
    private void describeImages(
            PDResources resources, int pageNumber, List<String> entries, Set<COSBase> visitedForms) {
        if (resources == null) {
            return;
        }
        for (COSName name : resources.getXObjectNames()) {
            try {
                PDXObject xObject = resources.getXObject(name);
                if (xObject instanceof PDImageXObject image) {
                    byte[] png = toPng(image.getImage());
                    entries.add("[Image from page " + pageNumber + "]: " + describer.describeEmbedded(png));
                } else if (xObject instanceof PDFormXObject form && visitedForms.add(form.getCOSObject())) {
                    describeImages(form.getResources(), pageNumber, entries, visitedForms);
                }
            } catch (IOException imageFailure) {
                log.warn("[EXTRACT] Skipping unreadable image {} on page {}: {}",
                        name.getName(), pageNumber, imageFailure.getMessage());
            }
        }
    }

    private static byte[] toPng(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(image, "png", out)) {
            throw new IOException("No PNG writer available");
        }
        return out.toByteArray();
    }
}
