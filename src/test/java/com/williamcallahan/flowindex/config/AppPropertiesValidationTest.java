package com.williamcallahan.flowindex.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * Verifies startup validation of the {@code app.*} tree.
 */
class AppPropertiesValidationTest {

    @Test
    void defaultsAreValid() {
        assertDoesNotThrow(new AppProperties()::validateConfiguration);
    }

    @Test
    void rejectsOverlapNotSmallerThanChunkSize() {
        AppProperties appProperties = new AppProperties();
        appProperties.getIngestion().setChunkSize(500);
        appProperties.getIngestion().setChunkOverlap(500);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveWorkerThreads() {
        AppProperties appProperties = new AppProperties();
        appProperties.getIngestion().setWorkerThreads(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsBlankUploadDir() {
        AppProperties appProperties = new AppProperties();
        appProperties.getIngestion().setUploadDir(" ");

        assertThrows(IllegalStateException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveUpsertBatchSize() {
        AppProperties appProperties = new AppProperties();
        appProperties.getQdrant().setUpsertBatchSize(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsZeroEmbeddingTimeout() {
        AppProperties appProperties = new AppProperties();
        appProperties.getInference().setEmbeddingTimeout(Duration.ZERO);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNullServerUrlAtBindTime() {
        InferenceProperties inference = new InferenceProperties();

        assertThrows(IllegalArgumentException.class, () -> inference.setServerUrl(null));
    }
}
