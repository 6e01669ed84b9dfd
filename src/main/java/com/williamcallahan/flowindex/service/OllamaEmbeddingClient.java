package com.williamcallahan.flowindex.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.flowindex.config.InferenceProperties;
import com.williamcallahan.flowindex.domain.inference.EmbeddingProbeResult;
import com.williamcallahan.flowindex.domain.inference.ModelCatalog;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Inference client for an Ollama-compatible server.
 *
 * <p>Text embedding and image description use separate HTTP clients because vision calls
 * legitimately run for minutes while a text embedding that takes longer than its timeout is
 * treated as failed. No synthetic vectors are ever returned.</p>
 */
public class OllamaEmbeddingClient implements EmbeddingClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String DIMENSION_PROBE_TEXT = "Sample text for dimension detection";
    static final String MODEL_PROBE_TEXT = "This is a test sentence for embedding model verification.";
    private static final int MAX_ERROR_SNIPPET = 512;
    private static final int PROBE_SAMPLE_SIZE = 5;

    private final String baseUrl;
    private final InferenceProperties inference;
    private final RestTemplate embeddingTemplate;
    private final RestTemplate visionTemplate;
    private final Map<String, Integer> vectorSizeByModel = new ConcurrentHashMap<>();

    /**
     * Creates a client from inference configuration.
     *
     * @param inference server, model and timeout settings
     * @param restTemplateBuilder RestTemplate builder
     */
    public OllamaEmbeddingClient(InferenceProperties inference, RestTemplateBuilder restTemplateBuilder) {
        this.inference = Objects.requireNonNull(inference, "inference");
        Objects.requireNonNull(restTemplateBuilder, "restTemplateBuilder");
        this.baseUrl = stripTrailingSlash(inference.getServerUrl());
        this.embeddingTemplate = restTemplateBuilder
                .connectTimeout(inference.getConnectTimeout())
                .readTimeout(inference.getEmbeddingTimeout())
                .build();
        this.visionTemplate = restTemplateBuilder
                .connectTimeout(inference.getConnectTimeout())
                .readTimeout(inference.getVisionTimeout())
                .build();
    }

    @Override
    public float[] embedText(String text) {
        String safeText = Objects.requireNonNullElse(text, "");
        String model = inference.getEmbeddingModel();
        log.debug("[EMBEDDING] Embedding {} chars with {}", safeText.length(), model);
        JsonNode response = post(
                embeddingTemplate,
                inference.getEmbeddingsPath(),
                new EmbeddingRequestPayload(model, safeText),
                "embedding",
                inference.getEmbeddingTimeout());
        return toVector(response.get("embedding"));
    }

    @Override
    public String describeImage(byte[] imageBytes) {
        return describeImage(imageBytes, inference.getVisionPrompt());
    }

    @Override
    public String describeImage(byte[] imageBytes, String prompt) {
        Objects.requireNonNull(imageBytes, "imageBytes");
        String effectivePrompt = prompt == null || prompt.isBlank() ? inference.getVisionPrompt() : prompt;
        String encoded = Base64.getEncoder().encodeToString(imageBytes);
        log.debug("[VISION] Describing {} byte image with {}", imageBytes.length, inference.getVisionModel());
        JsonNode response = post(
                visionTemplate,
                inference.getGeneratePath(),
                new GenerateRequestPayload(inference.getVisionModel(), effectivePrompt, List.of(encoded), false),
                "vision",
                inference.getVisionTimeout());
        JsonNode description = response.get("response");
        if (description == null || !description.isTextual()) {
            throw new MalformedInferenceResponseException("Vision response missing 'response' text field");
        }
        if (description.asText().isBlank()) {
            throw new MalformedInferenceResponseException("Empty response from vision model");
        }
        return description.asText().trim();
    }

    @Override
    public int vectorSize() {
        String model = inference.getEmbeddingModel();
        Integer cached = vectorSizeByModel.get(model);
        if (cached != null) {
            return cached;
        }
        int detected = embedText(DIMENSION_PROBE_TEXT).length;
        Integer raced = vectorSizeByModel.putIfAbsent(model, detected);
        if (raced == null) {
            log.info("[EMBEDDING] Detected vector size {} for model {}", detected, model);
            return detected;
        }
        return raced;
    }

    @Override
    public void clearVectorSizeCache() {
        vectorSizeByModel.clear();
    }

    @Override
    public ModelCatalog listModels() {
        String url = baseUrl + inference.getTagsPath();
        String body;
        try {
            body = embeddingTemplate.getForObject(url, String.class);
        } catch (RestClientException | CancellationException exception) {
            throw translate(exception, "model listing", inference.getEmbeddingTimeout());
        }
        JsonNode models = parse(body, "model listing").get("models");
        if (models == null || !models.isArray()) {
            throw new MalformedInferenceResponseException("Model listing missing 'models' array");
        }
        List<String> names = new ArrayList<>();
        for (JsonNode model : models) {
            String name = model.path("name").asText("");
            if (!name.isBlank()) {
                names.add(name);
            }
        }
        return ModelCatalog.categorize(names);
    }

    @Override
    public boolean isVisionModelAvailable() {
        return listModels().hasModel(inference.getVisionModel());
    }

    @Override
    public EmbeddingProbeResult probeEmbeddingModel() {
        long startNanos = System.nanoTime();
        float[] vector = embedText(MODEL_PROBE_TEXT);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        List<Float> sample = new ArrayList<>(PROBE_SAMPLE_SIZE);
        for (int index = 0; index < Math.min(PROBE_SAMPLE_SIZE, vector.length); index++) {
            sample.add(vector[index]);
        }
        return new EmbeddingProbeResult(inference.getEmbeddingModel(), vector.length, elapsed, sample);
    }

    @Override
    public String embeddingModel() {
        return inference.getEmbeddingModel();
    }

    private JsonNode post(RestTemplate template, String path, Object payload, String operation, Duration timeout) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String body;
        try {
            body = template.postForObject(baseUrl + path, new HttpEntity<>(payload, headers), String.class);
        } catch (RestClientException | CancellationException exception) {
            throw translate(exception, operation, timeout);
        }
        return parse(body, operation);
    }

    /**
     * Maps transport failures onto the inference exception types.
     *
     * <p>The JDK request factory cancels the pending exchange when its read timeout fires; depending
     * on timing the caller sees either a timeout cause or a bare {@link CancellationException}.
     * Both are reported as {@link InferenceTimeoutException}.</p>
     */
    private RuntimeException translate(RuntimeException exception, String operation, Duration timeout) {
        if (exception instanceof RestClientResponseException responseException) {
            return new InferenceServiceException(formatHttpFailure(operation, responseException), exception);
        }
        if (exception instanceof CancellationException
                || exception instanceof ResourceAccessException && hasTimeoutCause(exception)) {
            return new InferenceTimeoutException(
                    "Inference " + operation + " timed out after " + timeout.toMillis() + "ms", exception);
        }
        String details = sanitizeMessage(exception.getMessage());
        String failureMessage = details.isBlank()
                ? "Inference " + operation + " request failed against " + baseUrl
                : "Inference " + operation + " request failed against " + baseUrl + ": " + details;
        return new InferenceServiceException(failureMessage, exception);
    }

    private static JsonNode parse(String body, String operation) {
        if (body == null || body.isBlank()) {
            throw new MalformedInferenceResponseException("Inference " + operation + " response was empty");
        }
        try {
            JsonNode root = MAPPER.readTree(body);
            if (root == null || !root.isObject()) {
                throw new MalformedInferenceResponseException(
                        "Inference " + operation + " response was not a JSON object");
            }
            return root;
        } catch (JsonProcessingException parseFailure) {
            throw new MalformedInferenceResponseException(
                    "Inference " + operation + " response was not valid JSON: " + sanitizeMessage(body), parseFailure);
        }
    }

    private static float[] toVector(JsonNode embedding) {
        if (embedding == null || !embedding.isArray()) {
            throw new MalformedInferenceResponseException("Embedding response missing 'embedding' array");
        }
        if (embedding.isEmpty()) {
            throw new MalformedInferenceResponseException("Embedding response contained an empty vector");
        }
        float[] vector = new float[embedding.size()];
        for (int valueIndex = 0; valueIndex < embedding.size(); valueIndex++) {
            JsonNode value = embedding.get(valueIndex);
            if (value == null || !value.isNumber()) {
                throw new MalformedInferenceResponseException(
                        "Embedding value at index " + valueIndex + " is not numeric");
            }
            vector[valueIndex] = value.floatValue();
        }
        return vector;
    }

    private static boolean hasTimeoutCause(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof SocketTimeoutException
                    || current instanceof HttpTimeoutException
                    || current instanceof TimeoutException
                    || current instanceof CancellationException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String formatHttpFailure(String operation, RestClientResponseException exception) {
        String payload = sanitizeMessage(exception.getResponseBodyAsString());
        String prefix = "Inference " + operation + " returned HTTP " + exception.getStatusCode().value();
        return payload.isBlank() ? prefix : prefix + ": " + payload;
    }

    static String sanitizeMessage(String message) {
        if (message == null || message.isBlank()) {
            return "";
        }
        String sanitized = message.replace("\r", " ").replace("\n", " ").trim();
        if (sanitized.length() > MAX_ERROR_SNIPPET) {
            return sanitized.substring(0, MAX_ERROR_SNIPPET) + "...";
        }
        return sanitized;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private record EmbeddingRequestPayload(String model, String prompt) {}

    private record GenerateRequestPayload(String model, String prompt, List<String> images, boolean stream) {}
}
