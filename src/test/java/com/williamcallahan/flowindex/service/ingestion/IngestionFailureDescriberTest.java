package com.williamcallahan.flowindex.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.williamcallahan.flowindex.service.InferenceServiceException;
import com.williamcallahan.flowindex.service.InferenceTimeoutException;
import com.williamcallahan.flowindex.service.NoIndexableChunksException;
import com.williamcallahan.flowindex.service.VectorDimensionMismatchException;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.file.NoSuchFileException;
import org.junit.jupiter.api.Test;

class IngestionFailureDescriberTest {

    private final IngestionFailureDescriber describer = new IngestionFailureDescriber();

    @Test
    void registeredTypesCarryTheirHint() {
        assertEquals(
                "NoSuchFileException: /tmp/gone.txt [file does not exist]",
                describer.describe(new NoSuchFileException("/tmp/gone.txt")));
        assertEquals(
                "InferenceTimeoutException: embedding timed out [inference service did not answer in time]",
                describer.describe(
                        new InferenceTimeoutException("embedding timed out", new SocketTimeoutException())));
    }

    @Test
    void unregisteredTypesNameTheirCause() {
        NoIndexableChunksException failure = new NoIndexableChunksException(
                "No valid chunks were created from the file", true, new InferenceServiceException("503"));

        assertEquals(
                "NoIndexableChunksException: No valid chunks were created from the file"
                        + " [caused by: InferenceServiceException]",
                describer.describe(failure));
    }

    @Test
    void retriablePipelineFailuresWithoutCauseAreMarked() {
        assertEquals(
                "InferenceServiceException: HTTP 503 [retriable]",
                describer.describe(new InferenceServiceException("HTTP 503")));
    }

    @Test
    void permanentFailuresHaveNoSuffix() {
        assertEquals(
                "VectorDimensionMismatchException: " + new VectorDimensionMismatchException("docs", 768, 3).getMessage(),
                describer.describe(new VectorDimensionMismatchException("docs", 768, 3)));
        assertEquals("IOException", describer.describe(new IOException()));
    }
}
