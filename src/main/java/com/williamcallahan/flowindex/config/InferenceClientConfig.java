package com.williamcallahan.flowindex.config;

import com.williamcallahan.flowindex.service.EmbeddingClient;
import com.williamcallahan.flowindex.service.OllamaEmbeddingClient;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Inference client wiring for text embeddings and image descriptions.
 */
@Configuration
public class InferenceClientConfig {

    private static final Logger log = LoggerFactory.getLogger(InferenceClientConfig.class);

    /**
     * Creates the Ollama-compatible client from {@code app.inference.*}.
     *
     * @param appProperties application configuration
     * @param restTemplateBuilder Boot-managed RestTemplate builder
     * @return embedding and vision client
     */
    @Bean
    @ConditionalOnMissingBean(EmbeddingClient.class)
    public EmbeddingClient embeddingClient(AppProperties appProperties, RestTemplateBuilder restTemplateBuilder) {
        InferenceProperties inference = Objects.requireNonNull(appProperties, "appProperties").getInference();
        log.info(
                "[EMBEDDING] Using inference server {} (embedding={}, vision={})",
                inference.getServerUrl(),
                inference.getEmbeddingModel(),
                inference.getVisionModel());
        return new OllamaEmbeddingClient(inference, restTemplateBuilder);
    }
}
