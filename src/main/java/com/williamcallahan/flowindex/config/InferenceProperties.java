package com.williamcallahan.flowindex.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Inference service (embeddings + vision) configuration.
 */
public class InferenceProperties {

    private static final String URL_DEF = "http://127.0.0.1:11434";
    private static final String EMBEDDINGS_PATH_DEF = "/api/embeddings";
    private static final String GENERATE_PATH_DEF = "/api/generate";
    private static final String TAGS_PATH_DEF = "/api/tags";
    private static final String EMBEDDING_MODEL_DEF = "nomic-embed-text";
    private static final String VISION_MODEL_DEF = "llava";
    private static final String VISION_PROMPT_DEF =
            "Describe this image in detail, including objects, people, text, colors, and setting.";
    private static final Duration EMBEDDING_TIMEOUT_DEF = Duration.ofSeconds(30);
    private static final Duration VISION_TIMEOUT_DEF = Duration.ofMinutes(5);
    private static final Duration CONNECT_TIMEOUT_DEF = Duration.ofSeconds(10);
    private static final String URL_KEY = "app.inference.server-url";
    private static final String EMBEDDING_MODEL_KEY = "app.inference.embedding-model";
    private static final String VISION_MODEL_KEY = "app.inference.vision-model";
    private static final String NULL_TEXT_FMT = "%s must not be null.";
    private static final String BLANK_TEXT_FMT = "%s must not be blank.";
    private static final String POSITIVE_FMT = "%s must be a positive duration.";

    private String serverUrl = URL_DEF;
    private String embeddingsPath = EMBEDDINGS_PATH_DEF;
    private String generatePath = GENERATE_PATH_DEF;
    private String tagsPath = TAGS_PATH_DEF;
    private String embeddingModel = EMBEDDING_MODEL_DEF;
    private String visionModel = VISION_MODEL_DEF;
    private String visionPrompt = VISION_PROMPT_DEF;
    private Duration embeddingTimeout = EMBEDDING_TIMEOUT_DEF;
    private Duration visionTimeout = VISION_TIMEOUT_DEF;
    private Duration connectTimeout = CONNECT_TIMEOUT_DEF;

    public InferenceProperties() {}

    /**
     * Validates inference settings.
     */
    public void validateConfiguration() {
        requireNonBlank(URL_KEY, serverUrl);
        requireNonBlank(EMBEDDING_MODEL_KEY, embeddingModel);
        requireNonBlank(VISION_MODEL_KEY, visionModel);
        requirePositive("app.inference.embedding-timeout", embeddingTimeout);
        requirePositive("app.inference.vision-timeout", visionTimeout);
        requirePositive("app.inference.connect-timeout", connectTimeout);
    }

    public String getServerUrl() {
        return serverUrl;
    }

    public void setServerUrl(final String serverUrl) {
        this.serverUrl = requireNonNullText(URL_KEY, serverUrl);
    }

    public String getEmbeddingsPath() {
        return embeddingsPath;
    }

    public void setEmbeddingsPath(final String embeddingsPath) {
        this.embeddingsPath = requireNonNullText("app.inference.embeddings-path", embeddingsPath);
    }

    public String getGeneratePath() {
        return generatePath;
    }

    public void setGeneratePath(final String generatePath) {
        this.generatePath = requireNonNullText("app.inference.generate-path", generatePath);
    }

    public String getTagsPath() {
        return tagsPath;
    }

    public void setTagsPath(final String tagsPath) {
        this.tagsPath = requireNonNullText("app.inference.tags-path", tagsPath);
    }

    public String getEmbeddingModel() {
        return embeddingModel;
    }

    public void setEmbeddingModel(final String embeddingModel) {
        this.embeddingModel = requireNonNullText(EMBEDDING_MODEL_KEY, embeddingModel);
    }

    public String getVisionModel() {
        return visionModel;
    }

    public void setVisionModel(final String visionModel) {
        this.visionModel = requireNonNullText(VISION_MODEL_KEY, visionModel);
    }

    public String getVisionPrompt() {
        return visionPrompt;
    }

    public void setVisionPrompt(final String visionPrompt) {
        this.visionPrompt = requireNonNullText("app.inference.vision-prompt", visionPrompt);
    }

    public Duration getEmbeddingTimeout() {
        return embeddingTimeout;
    }

    public void setEmbeddingTimeout(final Duration embeddingTimeout) {
        this.embeddingTimeout = embeddingTimeout;
    }

    public Duration getVisionTimeout() {
        return visionTimeout;
    }

    public void setVisionTimeout(final Duration visionTimeout) {
        this.visionTimeout = visionTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(final Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    private static void requireNonBlank(final String propertyKey, final String text) {
        if (requireNonNullText(propertyKey, text).isBlank()) {
            throw new IllegalStateException(String.format(Locale.ROOT, BLANK_TEXT_FMT, propertyKey));
        }
    }

    private static void requirePositive(final String propertyKey, final Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, propertyKey));
        }
    }

    private static String requireNonNullText(final String propertyKey, final String text) {
        if (text == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_TEXT_FMT, propertyKey));
        }
        return text;
    }
}
