package com.williamcallahan.flowindex.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Root of the {@code app.*} configuration tree.
 */
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private InferenceProperties inference = new InferenceProperties();
    private QdrantProperties qdrant = new QdrantProperties();
    private IngestionProperties ingestion = new IngestionProperties();
    private VisionProperties vision = new VisionProperties();

    /**
     * Validates every nested section; called once the binder has populated the tree.
     */
    @PostConstruct
    public void validateConfiguration() {
        inference.validateConfiguration();
        qdrant.validateConfiguration();
        ingestion.validateConfiguration();
        vision.validateConfiguration();
    }

    public InferenceProperties getInference() {
        return inference;
    }

    public void setInference(InferenceProperties inference) {
        this.inference = inference;
    }

    public QdrantProperties getQdrant() {
        return qdrant;
    }

    public void setQdrant(QdrantProperties qdrant) {
        this.qdrant = qdrant;
    }

    public IngestionProperties getIngestion() {
        return ingestion;
    }

    public void setIngestion(IngestionProperties ingestion) {
        this.ingestion = ingestion;
    }

    public VisionProperties getVision() {
        return vision;
    }

    public void setVision(VisionProperties vision) {
        this.vision = vision;
    }
}
