package com.williamcallahan.flowindex.service.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.flowindex.config.AppProperties;
import com.williamcallahan.flowindex.domain.ingestion.ExtractedContent;
import com.williamcallahan.flowindex.domain.ingestion.FileType;
import com.williamcallahan.flowindex.service.ContentHasher;
import com.williamcallahan.flowindex.service.EmbeddingClient;
import com.williamcallahan.flowindex.service.ImageDescriptionCache;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import javax.imageio.ImageIO;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDFormContentStream;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.poi.sl.usermodel.PictureData;
import org.apache.poi.ss.usermodel.ClientAnchor;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFPictureData;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTextBox;
import org.apache.poi.xssf.usermodel.XSSFRow;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.apache.poi.xwpf.usermodel.Document;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies per-format extraction output against documents generated at test time.
 */
class ContentExtractorTest {

    @TempDir
    Path workDir;

    private EmbeddingClient embeddingClient;
    private ImageDescriptionCache cache;
    private ContentExtractor extractor;

    @BeforeEach
    void setUp() {
        embeddingClient = mock(EmbeddingClient.class);
        ContentHasher hasher = new ContentHasher();
        cache = new ImageDescriptionCache(hasher, 16);
        EmbeddedImageDescriber describer =
                new EmbeddedImageDescriber(cache, embeddingClient, new VisionImagePreparer(new AppProperties()));
        extractor = new ContentExtractor(
                new FileTypeDetector(),
                List.of(
                        new PlainTextExtractor(),
                        new PdfContentExtractor(describer),
                        new WordDocumentExtractor(describer, hasher),
                        new PresentationContentExtractor(describer),
                        new SpreadsheetContentExtractor(describer),
                        new ImageFileExtractor(describer)));
    }

    @Test
    void readsUtf8TextVerbatim() throws IOException {
        Path file = Files.writeString(workDir.resolve("notes.txt"), "héllo\nworld", StandardCharsets.UTF_8);

        ExtractedContent content = extractor.extract(file, true);

        assertEquals(FileType.TEXT, content.fileType());
        assertEquals("héllo\nworld", content.text());
    }

    @Test
    void invalidUtf8TextFailsWithDecodeError() throws IOException {
        Path file = Files.write(workDir.resolve("broken.txt"), new byte[] {'o', 'k', (byte) 0xC3, (byte) 0x28});

        DocumentDecodeException failure =
                assertThrows(DocumentDecodeException.class, () -> extractor.extract(file, false));
        assertFalse(failure.isRetriable());
    }

    @Test
    void unknownTypeIsUnsupported() throws IOException {
        Path file = Files.write(workDir.resolve("tool.exe"), new byte[] {(byte) 0xFF, (byte) 0xFE, (byte) 0xFF});

        assertEquals(FileType.UNKNOWN, extractor.detectType(file));
        assertThrows(UnsupportedFileTypeException.class, () -> extractor.extract(file, true));
    }

    @Test
    void pdfPagesAreConcatenated() throws IOException {
        Path file = workDir.resolve("report.pdf");
        try (PDDocument document = new PDDocument()) {
            addPage(document, "Quarterly revenue grew");
            addPage(document, "Second page summary");
            document.save(file.toFile());
        }

        ExtractedContent content = extractor.extract(file, true);

        assertEquals(FileType.PDF, content.fileType());
        assertTrue(content.text().contains("Quarterly revenue grew"));
        assertTrue(content.text().indexOf("Second page summary") > content.text().indexOf("Quarterly revenue grew"));
        assertFalse(content.text().contains("=== EMBEDDED IMAGES ==="));
    }

    @Test
    void pdfPageImagesAreDescribedWithPageNumber() throws IOException {
        when(embeddingClient.describeImage(any(byte[].class))).thenReturn("a pie chart");
        Path file = workDir.resolve("charts.pdf");
        try (PDDocument document = new PDDocument()) {
            addPage(document, "Intro");
            PDPage page = new PDPage();
            document.addPage(page);
            PDImageXObject image = LosslessFactory.createFromImage(document, solidImage(40, 30, Color.RED));
            try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                stream.drawImage(image, 72, 500, 40, 30);
            }
            document.save(file.toFile());
        }

        String text = extractor.extract(file, true).text();

        assertTrue(text.contains("=== EMBEDDED IMAGES ===\n\nImage 1: [Image from page 2]: a pie chart"));
        verify(embeddingClient, times(1)).describeImage(any(byte[].class));
    }

    @Test
    void pdfImagesNestedInFormXObjectsAreDescribed() throws IOException {
        when(embeddingClient.describeImage(any(byte[].class))).thenReturn("a watermark");
        Path file = workDir.resolve("stamped.pdf");
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage();
            document.addPage(page);
            PDImageXObject image = LosslessFactory.createFromImage(document, solidImage(20, 20, Color.BLUE));
            PDFormXObject form = new PDFormXObject(document);
            form.setBBox(new PDRectangle(0, 0, 100, 100));
            form.setResources(new PDResources());
            try (PDFormContentStream formStream = new PDFormContentStream(form)) {
                formStream.drawImage(image, 0, 0, 20, 20);
            }
            try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                stream.drawForm(form);
            }
            document.save(file.toFile());
        }

        String text = extractor.extract(file, true).text();

        assertTrue(text.contains("Image 1: [Image from page 1]: a watermark"));
    }

    @Test
    void samePictureInTwoDocumentsIsDescribedOnce() throws Exception {
        when(embeddingClient.describeImage(any(byte[].class))).thenReturn("a signature");
        byte[] picture = png(solidImage(16, 16, Color.GREEN));
        Path first = workDir.resolve("first.docx");
        Path second = workDir.resolve("second.docx");
        for (Path target : List.of(first, second)) {
            try (XWPFDocument document = new XWPFDocument()) {
                document.createParagraph().createRun().setText("Signed");
                document.addPictureData(picture, Document.PICTURE_TYPE_PNG);
                document.addPictureData(picture, Document.PICTURE_TYPE_PNG);
                save(document::write, target);
            }
        }

        String firstText = extractor.extract(first, true).text();
        String secondText = extractor.extract(second, true).text();

        assertTrue(firstText.contains("Image 1: [Word embedded image]: a signature"));
        assertFalse(firstText.contains("Image 2:"));
        assertEquals(firstText, secondText);
        verify(embeddingClient, times(1)).describeImage(any(byte[].class));
        assertEquals(1L, cache.stats().hits());
    }

    @Test
    void wordVectorPicturesAreNotSentToVision() throws Exception {
        Path file = workDir.resolve("memo.docx");
        try (XWPFDocument document = new XWPFDocument()) {
            document.createParagraph().createRun().setText("Memo");
            document.addPictureData(new byte[] {1, 0, 0, 0, 2}, Document.PICTURE_TYPE_EMF);
            save(document::write, file);
        }

        assertEquals("Memo", extractor.extract(file, true).text());
        verify(embeddingClient, never()).describeImage(any(byte[].class));
    }

    @Test
    void slidePicturesAreTaggedWithSlideNumber() throws Exception {
        when(embeddingClient.describeImage(any(byte[].class))).thenReturn("an org chart");
        Path file = workDir.resolve("pictures.pptx");
        try (XMLSlideShow slideShow = new XMLSlideShow()) {
            slideShow.createSlide().createTextBox().setText("Team");
            XSLFSlide second = slideShow.createSlide();
            XSLFPictureData pictureData =
                    slideShow.addPicture(png(solidImage(24, 12, Color.ORANGE)), PictureData.PictureType.PNG);
            second.createPicture(pictureData);
            save(slideShow::write, file);
        }

        String text = extractor.extract(file, true).text();

        assertTrue(text.contains("=== SLIDE 1 ===\nTeam"));
        assertTrue(text.contains("Image 1: [Image from slide 2]: an org chart"));
    }

    @Test
    void spreadsheetPicturesAreDescribed() throws Exception {
        when(embeddingClient.describeImage(any(byte[].class))).thenReturn("a bar chart");
        Path file = workDir.resolve("report.xlsx");
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            XSSFSheet sheet = workbook.createSheet("Report");
            sheet.createRow(0).createCell(0).setCellValue("Total");
            int pictureIndex = workbook.addPicture(png(solidImage(30, 20, Color.MAGENTA)), Workbook.PICTURE_TYPE_PNG);
            ClientAnchor anchor = workbook.getCreationHelper().createClientAnchor();
            anchor.setCol1(2);
            anchor.setRow1(2);
            sheet.createDrawingPatriarch().createPicture(anchor, pictureIndex);
            save(workbook::write, file);
        }

        String text = extractor.extract(file, true).text();

        assertTrue(text.contains("=== WORKSHEET: Report ===\nTotal"));
        assertTrue(text.contains("Image 1: [Excel embedded image]: a bar chart"));
    }

    @Test
    void wordParagraphsTablesAndImagesAreLinearized() throws Exception {
        when(embeddingClient.describeImage(any(byte[].class))).thenReturn("a company logo");
        Path file = workDir.resolve("letter.docx");
        try (XWPFDocument document = new XWPFDocument()) {
            document.createParagraph().createRun().setText("Dear team,");
            XWPFTable table = document.createTable(2, 2);
            table.getRow(0).getCell(0).setText("Name");
            table.getRow(0).getCell(1).setText("Role");
            table.getRow(1).getCell(0).setText("Ada");
            table.getRow(1).getCell(1).setText("Engineer");
            document.addPictureData(new byte[] {1, 2, 3, 4}, Document.PICTURE_TYPE_PNG);
            save(document::write, file);
        }

        String text = extractor.extract(file, true).text();

        assertTrue(text.startsWith("Dear team,"));
        assertTrue(text.contains("=== TABLE ===\nName | Role\nAda | Engineer\n"));
        assertTrue(text.contains("=== EMBEDDED IMAGES ===\n\nImage 1: [Word embedded image]: a company logo"));
    }

    @Test
    void wordImagesAreSkippedWhenNotRequested() throws Exception {
        Path file = workDir.resolve("plain.docx");
        try (XWPFDocument document = new XWPFDocument()) {
            document.createParagraph().createRun().setText("Only text");
            document.addPictureData(new byte[] {5, 6, 7}, Document.PICTURE_TYPE_PNG);
            save(document::write, file);
        }

        assertEquals("Only text", extractor.extract(file, false).text());
        verify(embeddingClient, never()).describeImage(any(byte[].class));
    }

    @Test
    void emptyWordDocumentYieldsFixedSentence() throws Exception {
        Path file = workDir.resolve("empty.docx");
        try (XWPFDocument document = new XWPFDocument()) {
            save(document::write, file);
        }

        assertEquals(WordDocumentExtractor.EMPTY_DOCUMENT, extractor.extract(file, true).text());
    }

    @Test
    void spreadsheetRowsAreJoinedAndEmptySheetsMarked() throws Exception {
        Path file = workDir.resolve("budget.xlsx");
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            XSSFSheet sheet = workbook.createSheet("Budget");
            XSSFRow header = sheet.createRow(0);
            header.createCell(0).setCellValue("Item");
            header.createCell(1).setCellValue("Cost");
            header.createCell(3).setCellValue("");
            XSSFRow data = sheet.createRow(1);
            data.createCell(0).setCellValue(" Laptop ");
            data.createCell(1).setCellValue(1200.0);
            data.createCell(2).setCellValue(true);
            workbook.createSheet("Notes");
            save(workbook::write, file);
        }

        String text = extractor.extract(file, false).text();

        assertTrue(text.contains("=== WORKSHEET: Budget ===\nItem | Cost\nLaptop | 1200 | True\n"));
        assertTrue(text.contains("=== WORKSHEET: Notes ===\n" + SpreadsheetContentExtractor.EMPTY_WORKSHEET));
    }

    @Test
    void slidesAreNumberedAndTagged() throws Exception {
        Path file = workDir.resolve("deck.pptx");
        try (XMLSlideShow slideShow = new XMLSlideShow()) {
            XSLFSlide first = slideShow.createSlide();
            XSLFTextBox title = first.createTextBox();
            title.setText("Roadmap 2025");
            slideShow.createSlide();
            XSLFSlide third = slideShow.createSlide();
            third.createTextBox().setText("Questions?");
            save(slideShow::write, file);
        }

        String text = extractor.extract(file, false).text();

        assertTrue(text.contains("=== SLIDE 1 ===\nRoadmap 2025"));
        assertTrue(text.contains("=== SLIDE 3 ===\nQuestions?"));
        assertFalse(text.contains("=== SLIDE 2 ==="));
    }

    @Test
    void imageFileContentIsItsDescription() throws IOException {
        when(embeddingClient.describeImage(any(byte[].class))).thenReturn("A mountain lake at dawn.");
        Path file = Files.write(workDir.resolve("lake.png"), new byte[] {(byte) 0x89, 'P', 'N', 'G'});

        ExtractedContent content = extractor.extract(file, false);

        assertEquals(FileType.IMAGE, content.fileType());
        assertEquals("A mountain lake at dawn.", content.text());
    }

    @Test
    void duplicateExtractorsAreRejected() {
        assertThrows(
                IllegalStateException.class,
                () -> new ContentExtractor(
                        new FileTypeDetector(), List.of(new PlainTextExtractor(), new PlainTextExtractor())));
    }

    private static void addPage(PDDocument document, String line) throws IOException {
        PDPage page = new PDPage();
        document.addPage(page);
        try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
            stream.beginText();
            stream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
            stream.newLineAtOffset(72, 700);
            stream.showText(line);
            stream.endText();
        }
    }

    private static BufferedImage solidImage(int width, int height, Color color) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setColor(color);
            graphics.fillRect(0, 0, width, height);
        } finally {
            graphics.dispose();
        }
        return image;
    }

    private static byte[] png(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }

    private static void save(DocumentWriter writer, Path target) throws IOException {
        try (OutputStream out = Files.newOutputStream(target)) {
            writer.write(out);
        }
    }

    @FunctionalInterface
    private interface DocumentWriter {
        void write(OutputStream out) throws IOException;
    }
}
