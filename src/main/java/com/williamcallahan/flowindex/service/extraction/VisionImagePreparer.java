package com.williamcallahan.flowindex.service.extraction;

import com.williamcallahan.flowindex.config.AppProperties;
import com.williamcallahan.flowindex.config.VisionProperties;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Objects;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Re-encodes images as RGB JPEG, downscaled to fit the configured bounds, before vision calls.
 *
 * <p>Aspect ratio is preserved and images already inside the bounds keep their size. Bytes that
 * cannot be decoded or encoded are returned unchanged so the model still sees the original.</p>
 */
@Component
public class VisionImagePreparer {

    private static final Logger log = LoggerFactory.getLogger(VisionImagePreparer.class);

    private static final String JPEG_FORMAT = "jpeg";

    private final VisionProperties vision;

    public VisionImagePreparer(AppProperties appProperties) {
        this.vision = Objects.requireNonNull(appProperties, "appProperties").getVision();
    }

    /**
     * Prepares image bytes for the vision model.
     *
     * @param imageBytes raw image bytes in any ImageIO-readable format
     * @return JPEG bytes within the configured bounds, or the input when it cannot be processed
     */
    public byte[] prepare(byte[] imageBytes) {
        Objects.requireNonNull(imageBytes, "imageBytes");
        try {
            BufferedImage source = ImageIO.read(new ByteArrayInputStream(imageBytes));
            if (source == null) {
                log.debug("[VISION] No ImageIO reader for {} bytes; sending as-is", imageBytes.length);
                return imageBytes;
            }
            return encodeJpeg(scaleToBounds(source));
        } catch (IOException | RuntimeException processingFailure) {
            log.warn("[VISION] Could not resize image ({}): {}; sending original bytes",
                    processingFailure.getClass().getSimpleName(), processingFailure.getMessage());
            return imageBytes;
        }
    }

    private BufferedImage scaleToBounds(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();
        double scale = Math.min(1.0, Math.min(
                (double) vision.getMaxWidth() / width,
                (double) vision.getMaxHeight() / height));
        int targetWidth = Math.max(1, (int) Math.round(width * scale));
        int targetHeight = Math.max(1, (int) Math.round(height * scale));

        BufferedImage canvas = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = canvas.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            // transparent pixels flatten onto white
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, targetWidth, targetHeight);
            graphics.drawImage(source, 0, 0, targetWidth, targetHeight, null);
        } finally {
            graphics.dispose();
        }
        return canvas;
    }

    private byte[] encodeJpeg(BufferedImage image) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(JPEG_FORMAT);
        if (!writers.hasNext()) {
            throw new IOException("No ImageIO writer available for JPEG format");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try (ImageOutputStream imageOutput = ImageIO.createImageOutputStream(output)) {
            writer.setOutput(imageOutput);
            ImageWriteParam params = writer.getDefaultWriteParam();
            params.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            params.setCompressionQuality(vision.getJpegQuality() / 100f);
            writer.write(null, new IIOImage(image, null, null), params);
        } finally {
            writer.dispose();
        }
        return output.toByteArray();
    }
}
