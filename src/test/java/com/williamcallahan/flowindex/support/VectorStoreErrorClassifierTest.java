package com.williamcallahan.flowindex.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;

class VectorStoreErrorClassifierTest {

    @Test
    void grpcStatusDecidesTransience() {
        assertTrue(VectorStoreErrorClassifier.isTransientVectorStoreError(new StatusRuntimeException(Status.UNAVAILABLE)));
        assertTrue(VectorStoreErrorClassifier.isTransientVectorStoreError(
                new StatusRuntimeException(Status.RESOURCE_EXHAUSTED)));
        assertFalse(VectorStoreErrorClassifier.isTransientVectorStoreError(new StatusRuntimeException(Status.NOT_FOUND)));
        assertFalse(VectorStoreErrorClassifier.isTransientVectorStoreError(
                new StatusRuntimeException(Status.INVALID_ARGUMENT)));
    }

    @Test
    void wrappedStatusIsFoundThroughCauses() {
        ExecutionException wrapped =
                new ExecutionException("call failed", new StatusRuntimeException(Status.DEADLINE_EXCEEDED));

        assertTrue(VectorStoreErrorClassifier.isTransientVectorStoreError(new IllegalStateException(wrapped)));
    }

    @Test
    void timeoutsAreTransientAndBadArgumentsAreNot() {
        assertTrue(VectorStoreErrorClassifier.isTransientVectorStoreError(
                new RuntimeException(new TimeoutException("no answer"))));
        assertFalse(VectorStoreErrorClassifier.isTransientVectorStoreError(
                new IllegalArgumentException("connection id is malformed")));
    }

    @Test
    void messagesMapToCategories() {
        assertEquals("Not Found", VectorStoreErrorClassifier.determineErrorType(
                new RuntimeException("Collection `docs` doesn't exist!")));
        assertEquals("Connection Error", VectorStoreErrorClassifier.determineErrorType(
                new RuntimeException("outer", new RuntimeException("Connection refused"))));
        assertEquals("Dimension Mismatch", VectorStoreErrorClassifier.determineErrorType(
                new RuntimeException("Wrong input: Vector dimension error: expected dim: 768, got 3")));
        assertEquals("Unknown Error", VectorStoreErrorClassifier.determineErrorType(new RuntimeException()));
    }
}
