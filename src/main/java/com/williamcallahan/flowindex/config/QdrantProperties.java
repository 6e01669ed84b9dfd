package com.williamcallahan.flowindex.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Qdrant connection and paging configuration.
 */
public class QdrantProperties {

    private static final String HOST_DEF = "localhost";
    private static final int GRPC_PORT_DEF = 6334;
    private static final int SCROLL_PAGE_SIZE_DEF = 100;
    private static final int LIST_PAGE_SIZE_DEF = 256;
    private static final int UPSERT_BATCH_SIZE_DEF = 256;
    private static final int MAX_ATTEMPTS_DEF = 3;
    private static final Duration OPERATION_TIMEOUT_DEF = Duration.ofSeconds(30);
    private static final Duration INITIAL_BACKOFF_DEF = Duration.ofMillis(500);
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private String host = HOST_DEF;
    private int port = GRPC_PORT_DEF;
    private boolean useTls;
    private String apiKey = "";
    private int scrollPageSize = SCROLL_PAGE_SIZE_DEF;
    private int listPageSize = LIST_PAGE_SIZE_DEF;
    private int upsertBatchSize = UPSERT_BATCH_SIZE_DEF;
    private int maxAttempts = MAX_ATTEMPTS_DEF;
    private Duration operationTimeout = OPERATION_TIMEOUT_DEF;
    private Duration initialBackoff = INITIAL_BACKOFF_DEF;

    public QdrantProperties() {}

    /**
     * Validates Qdrant settings.
     */
    public void validateConfiguration() {
        if (host == null || host.isBlank()) {
            throw new IllegalStateException("app.qdrant.host must not be blank.");
        }
        requirePositive("app.qdrant.port", port);
        requirePositive("app.qdrant.scroll-page-size", scrollPageSize);
        requirePositive("app.qdrant.list-page-size", listPageSize);
        requirePositive("app.qdrant.upsert-batch-size", upsertBatchSize);
        requirePositive("app.qdrant.max-attempts", maxAttempts);
        if (operationTimeout == null || operationTimeout.isZero() || operationTimeout.isNegative()) {
            throw new IllegalArgumentException("app.qdrant.operation-timeout must be a positive duration.");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("app.qdrant.initial-backoff must not be negative.");
        }
    }

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }

    public boolean isUseTls() { return useTls; }
    public void setUseTls(boolean useTls) { this.useTls = useTls; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey == null ? "" : apiKey; }

    public int getScrollPageSize() { return scrollPageSize; }
    public void setScrollPageSize(int scrollPageSize) { this.scrollPageSize = scrollPageSize; }

    public int getListPageSize() { return listPageSize; }
    public void setListPageSize(int listPageSize) { this.listPageSize = listPageSize; }

    public int getUpsertBatchSize() { return upsertBatchSize; }
    public void setUpsertBatchSize(int upsertBatchSize) { this.upsertBatchSize = upsertBatchSize; }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public Duration getOperationTimeout() { return operationTimeout; }
    public void setOperationTimeout(Duration operationTimeout) { this.operationTimeout = operationTimeout; }

    public Duration getInitialBackoff() { return initialBackoff; }
    public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }

    private static void requirePositive(String propertyKey, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, propertyKey));
        }
    }
}
