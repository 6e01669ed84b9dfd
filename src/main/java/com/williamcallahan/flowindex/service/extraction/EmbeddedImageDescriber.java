package com.williamcallahan.flowindex.service.extraction;

import com.williamcallahan.flowindex.service.EmbeddingClient;
import com.williamcallahan.flowindex.service.ImageDescriptionCache;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Describes images through the vision model, consulting the description cache first.
 *
 * <p>Images are downscaled before the vision call; the cache stays keyed on the original bytes.
 * The vision call runs outside the cache lock, so two threads describing the same new
 * image may both call the model; the later write wins with an identical key.</p>
 */
@Component
public class EmbeddedImageDescriber {

    private static final Logger log = LoggerFactory.getLogger(EmbeddedImageDescriber.class);

    static final String NO_DESCRIPTION = "No description available for this image.";
    static final String FAILED_DESCRIPTION = "Failed to describe this image.";

    private final ImageDescriptionCache cache;
    private final EmbeddingClient embeddingClient;
    private final VisionImagePreparer imagePreparer;

    public EmbeddedImageDescriber(
            ImageDescriptionCache cache, EmbeddingClient embeddingClient, VisionImagePreparer imagePreparer) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.embeddingClient = Objects.requireNonNull(embeddingClient, "embeddingClient");
        this.imagePreparer = Objects.requireNonNull(imagePreparer, "imagePreparer");
    }

    /**
     * Describes an image found inside a document.
     *
     * <p>A vision failure is cached and returned as a fixed sentence so one unreadable picture
     * does not fail the whole document.</p>
     *
     * @param imageBytes raw image bytes
     * @return description, never blank
     */
    public String describeEmbedded(byte[] imageBytes) {
        Optional<String> cached = cache.get(imageBytes);
        if (cached.isPresent()) {
            return cached.get();
        }
        String description;
        try {
            description = normalize(embeddingClient.describeImage(imagePreparer.prepare(imageBytes)));
        } catch (RuntimeException visionFailure) {
            log.warn("[VISION] Embedded image description failed ({}): {}",
                    visionFailure.getClass().getSimpleName(), visionFailure.getMessage());
            description = FAILED_DESCRIPTION;
        }
        cache.put(imageBytes, description);
        return description;
    }

    /**
     * Describes an uploaded image file; vision failures propagate to the caller.
     *
     * @param imageBytes raw image bytes
     * @return description, never blank
     */
    public String describeStandalone(byte[] imageBytes) {
        Optional<String> cached = cache.get(imageBytes);
        if (cached.isPresent() && !FAILED_DESCRIPTION.equals(cached.get())) {
            return cached.get();
        }
        String description = normalize(embeddingClient.describeImage(imagePreparer.prepare(imageBytes)));
        cache.put(imageBytes, description);
        return description;
    }

    private static String normalize(String description) {
        if (description == null || description.isBlank()) {
            return NO_DESCRIPTION;
        }
        return description.strip();
    }
}
