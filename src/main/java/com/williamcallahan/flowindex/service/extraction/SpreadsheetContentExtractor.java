package com.williamcallahan.flowindex.service.extraction;

import com.williamcallahan.flowindex.domain.ingestion.FileType;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFPictureData;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

/**
 * Extracts worksheet rows from Excel workbooks.
 *
 * <p>Rows are emitted between the first and last non-empty row as trimmed cell strings joined
 * with {@code " | "}, trailing empty cells removed. Formula cells contribute their cached value.</p>
 */
@Component
public class SpreadsheetContentExtractor implements DocumentExtractor {

    static final String EMPTY_WORKBOOK = "No data found in Excel file.";
    static final String EMPTY_WORKSHEET = "(Empty worksheet)";
    private static final String CELL_SEPARATOR = " | ";

    private final EmbeddedImageDescriber describer;
    private final DataFormatter dateFormatter = new DataFormatter();

    public SpreadsheetContentExtractor(EmbeddedImageDescriber describer) {
        this.describer = Objects.requireNonNull(describer, "describer");
    }

    @Override
    public FileType supportedType() {
        return FileType.XLSX;
    }

    @Override
    public String extract(Path path, boolean includeImages) throws IOException {
        try (InputStream in = Files.newInputStream(path);
                XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            List<String> lines = new ArrayList<>();
            for (Sheet sheet : workbook) {
                lines.add("=== WORKSHEET: " + sheet.getSheetName() + " ===");
                List<String> rows = extractRows(sheet);
                if (rows.isEmpty()) {
                    lines.add(EMPTY_WORKSHEET);
                } else {
                    lines.addAll(rows);
                }
                lines.add("");
            }

            String result = String.join("\n", lines);
            if (includeImages) {
                result = EmbeddedImagesSection.append(result, describeImages(workbook));
            }
            return result.isBlank() ? EMPTY_WORKBOOK : result;
        }
    }

    private List<String> extractRows(Sheet sheet) {
        int columnCount = 0;
        for (Row row : sheet) {
            columnCount = Math.max(columnCount, row.getLastCellNum());
        }
        List<String> rows = new ArrayList<>();
        for (int rowIndex = sheet.getFirstRowNum(); rowIndex <= sheet.getLastRowNum() && rowIndex >= 0; rowIndex++) {
            Row row = sheet.getRow(rowIndex);
            if (row == null) {
                continue;
            }
            List<String> cells = new ArrayList<>(columnCount);
            for (int columnIndex = 0; columnIndex < columnCount; columnIndex++) {
                cells.add(cellText(row.getCell(columnIndex)));
            }
            while (!cells.isEmpty() && cells.get(cells.size() - 1).isEmpty()) {
                cells.remove(cells.size() - 1);
            }
            if (!cells.isEmpty()) {
                rows.add(String.join(CELL_SEPARATOR, cells));
            }
        }
        return rows;
    }

    private String cellText(Cell cell) {
        if (cell == null) {
            return "";
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        String text = switch (type) {
            case STRING -> cell.getStringCellValue();
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                    ? dateFormatter.formatCellValue(cell)
                    : numericText(cell.getNumericCellValue());
            case BOOLEAN -> cell.getBooleanCellValue() ? "True" : "False";
            default -> "";
        };
        return text.strip();
    }

    private static String numericText(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private List<String> describeImages(XSSFWorkbook workbook) {
        List<String> entries = new ArrayList<>();
        for (XSSFPictureData picture : workbook.getAllPictures()) {
            if (OfficeImageFilter.isDescribableExcelImage(picture.suggestFileExtension())) {
                entries.add("[Excel embedded image]: " + describer.describeEmbedded(picture.getData()));
            }
        }
        return entries;
    }
}
