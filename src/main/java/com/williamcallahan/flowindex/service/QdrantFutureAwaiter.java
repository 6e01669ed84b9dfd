package com.williamcallahan.flowindex.service;

import com.google.common.util.concurrent.ListenableFuture;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

final class QdrantFutureAwaiter {

    private QdrantFutureAwaiter() {}

    static <T> T awaitFuture(ListenableFuture<T> future, Duration timeout, String operation) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new VectorStoreException("Qdrant " + operation + " interrupted", interrupted);
        } catch (ExecutionException executionException) {
            Throwable cause = executionException.getCause();
            if (cause == null) {
                throw new VectorStoreException("Qdrant " + operation + " failed", executionException);
            }
            throw new VectorStoreException("Qdrant " + operation + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException timeoutException) {
            future.cancel(true);
            throw new VectorStoreException(
                    "Qdrant " + operation + " timed out after " + timeout.toMillis() + "ms", timeoutException);
        }
    }
}
