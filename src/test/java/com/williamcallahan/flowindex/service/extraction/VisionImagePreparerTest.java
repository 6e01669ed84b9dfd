package com.williamcallahan.flowindex.service.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.williamcallahan.flowindex.config.AppProperties;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VisionImagePreparerTest {

    private AppProperties appProperties;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        appProperties.getVision().setMaxWidth(800);
        appProperties.getVision().setMaxHeight(600);
    }

    @Test
    void tallImageIsBoundedByHeightKeepingAspectRatio() throws IOException {
        BufferedImage prepared = decode(new VisionImagePreparer(appProperties).prepare(png(1_000, 2_000)));

        assertEquals(300, prepared.getWidth());
        assertEquals(600, prepared.getHeight());
    }

    @Test
    void smallImageKeepsItsSizeButIsReencodedAsJpeg() throws IOException {
        byte[] prepared = new VisionImagePreparer(appProperties).prepare(png(120, 80));

        assertEquals((byte) 0xFF, prepared[0]);
        assertEquals((byte) 0xD8, prepared[1]);
        BufferedImage decoded = decode(prepared);
        assertEquals(120, decoded.getWidth());
        assertEquals(80, decoded.getHeight());
    }

    @Test
    void unreadableBytesAreReturnedAsIs() {
        byte[] notAnImage = {0x25, 0x50, 0x44, 0x46};

        assertSame(notAnImage, new VisionImagePreparer(appProperties).prepare(notAnImage));
    }

    @Test
    void qualityOutsidePercentRangeIsRejected() {
        appProperties.getVision().setJpegQuality(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    private static BufferedImage decode(byte[] bytes) throws IOException {
        return ImageIO.read(new ByteArrayInputStream(bytes));
    }

    private static byte[] png(int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        ImageIO.write(image, "png", output);
        return output.toByteArray();
    }
}
