package com.williamcallahan.flowindex.config;

import java.util.Locale;

/**
 * Bounds applied to images before they are sent to the vision model.
 */
public class VisionProperties {

    private static final int MAX_WIDTH_DEF = 1_024;
    private static final int MAX_HEIGHT_DEF = 1_024;
    private static final int JPEG_QUALITY_DEF = 85;
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private int maxWidth = MAX_WIDTH_DEF;
    private int maxHeight = MAX_HEIGHT_DEF;
    private int jpegQuality = JPEG_QUALITY_DEF;

    public VisionProperties() {}

    /**
     * Validates the resize bounds and the JPEG quality percentage.
     */
    public void validateConfiguration() {
        requirePositive("app.vision.max-width", maxWidth);
        requirePositive("app.vision.max-height", maxHeight);
        if (jpegQuality < 1 || jpegQuality > 100) {
            throw new IllegalArgumentException("app.vision.jpeg-quality must be in [1, 100]; got " + jpegQuality);
        }
    }

    public int getMaxWidth() { return maxWidth; }
    public void setMaxWidth(int maxWidth) { this.maxWidth = maxWidth; }

    public int getMaxHeight() { return maxHeight; }
    public void setMaxHeight(int maxHeight) { this.maxHeight = maxHeight; }

    public int getJpegQuality() { return jpegQuality; }
    public void setJpegQuality(int jpegQuality) { this.jpegQuality = jpegQuality; }

    private static void requirePositive(String propertyKey, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, propertyKey));
        }
    }
}
