package com.williamcallahan.flowindex.domain.inference;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a single test embedding call.
 *
 * @param model embedding model that answered
 * @param vectorSize length of the returned vector
 * @param responseTime wall-clock duration of the call
 * @param sampleValues first few vector components
 */
public record EmbeddingProbeResult(String model, int vectorSize, Duration responseTime, List<Float> sampleValues) {

    public EmbeddingProbeResult {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(responseTime, "responseTime");
        sampleValues = List.copyOf(Objects.requireNonNull(sampleValues, "sampleValues"));
    }
}
