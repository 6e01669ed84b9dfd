package com.williamcallahan.flowindex.service;

import com.williamcallahan.flowindex.domain.inference.EmbeddingProbeResult;
import com.williamcallahan.flowindex.domain.inference.ModelCatalog;

/**
 * Port to the inference service that embeds text and describes images.
 *
 * <p>Implementations fail with {@link InferenceServiceException} on non-2xx answers or
 * unreachable hosts, {@link InferenceTimeoutException} when the bounded wait elapses, and
 * {@link MalformedInferenceResponseException} when the expected field is missing or unusable.</p>
 */
public interface EmbeddingClient {

    /**
     * Embeds one text with the configured embedding model.
     *
     * @param text input text
     * @return embedding vector, never empty
     */
    float[] embedText(String text);

    /**
     * Describes an image with the configured vision model and default prompt.
     *
     * @param imageBytes raw image bytes
     * @return model description, possibly blank
     */
    String describeImage(byte[] imageBytes);

    /**
     * Describes an image with the configured vision model.
     *
     * @param imageBytes raw image bytes
     * @param prompt instruction sent with the image
     * @return model description, possibly blank
     */
    String describeImage(byte[] imageBytes, String prompt);

    /**
     * Returns the embedding dimensionality of the configured model, probing the service once per model.
     *
     * @return vector size
     */
    int vectorSize();

    /**
     * Forgets memoized vector sizes so the next {@link #vectorSize()} call probes again.
     */
    void clearVectorSizeCache();

    /**
     * Lists models advertised by the inference service.
     *
     * @return categorized model names
     */
    ModelCatalog listModels();

    /**
     * Returns true when the configured vision model is installed on the inference service.
     */
    boolean isVisionModelAvailable();

    /**
     * Embeds a fixed test sentence and reports size, latency and sample values.
     *
     * @return probe outcome
     */
    EmbeddingProbeResult probeEmbeddingModel();

    /**
     * Returns the configured embedding model name.
     */
    String embeddingModel();
}
