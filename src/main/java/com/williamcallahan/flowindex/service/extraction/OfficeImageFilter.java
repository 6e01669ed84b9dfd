package com.williamcallahan.flowindex.service.extraction;

import java.util.Locale;
import java.util.Set;

/**
 * Decides which embedded Office media are worth sending to the vision model.
 */
final class OfficeImageFilter {

    private static final Set<String> WORD_IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg", "gif", "bmp", "tiff");
    private static final Set<String> EXCEL_IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg", "gif", "bmp");

    private OfficeImageFilter() {}

    /**
     * Word media; vector EMF/WMF pictures are never described.
     */
    static boolean isDescribableWordImage(String extension) {
        return WORD_IMAGE_EXTENSIONS.contains(normalize(extension));
    }

    static boolean isDescribableExcelImage(String extension) {
        return EXCEL_IMAGE_EXTENSIONS.contains(normalize(extension));
    }

    private static String normalize(String extension) {
        if (extension == null) {
            return "";
        }
        String lower = extension.toLowerCase(Locale.ROOT);
        return lower.startsWith(".") ? lower.substring(1) : lower;
    }
}
