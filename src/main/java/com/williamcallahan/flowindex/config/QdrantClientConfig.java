package com.williamcallahan.flowindex.config;

import com.williamcallahan.flowindex.service.QdrantVectorStoreGateway;
import com.williamcallahan.flowindex.service.VectorStoreGateway;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.QdrantGrpcClient;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Qdrant gRPC client with keepalive, and the gateway built on it.
 *
 * <p>Active unless {@code app.vector-store.provider} selects another store.</p>
 */
@Configuration
@ConditionalOnProperty(name = "app.vector-store.provider", havingValue = "qdrant", matchIfMissing = true)
public class QdrantClientConfig {

    private static final Logger log = LoggerFactory.getLogger(QdrantClientConfig.class);

    /** Keepalive ping interval in seconds. */
    private static final long KEEPALIVE_TIME_SECONDS = 30;
    /** Keepalive timeout before connection is considered dead. */
    private static final long KEEPALIVE_TIMEOUT_SECONDS = 10;
    /** Idle timeout before keepalive pings start. */
    private static final long IDLE_TIMEOUT_MINUTES = 5;

    /**
     * Creates a QdrantClient with gRPC keepalive configured for long-lived ingestion workers.
     *
     * @param appProperties application configuration
     * @return configured Qdrant client; closed with the context
     */
    @Bean
    public QdrantClient qdrantClient(AppProperties appProperties) {
        QdrantProperties qdrant = Objects.requireNonNull(appProperties, "appProperties").getQdrant();
        log.info("[QDRANT] Connecting to {}:{} (tls={})", qdrant.getHost(), qdrant.getPort(), qdrant.isUseTls());

        ManagedChannelBuilder<?> channelBuilder = ManagedChannelBuilder.forAddress(qdrant.getHost(), qdrant.getPort());
        if (qdrant.isUseTls()) {
            channelBuilder.useTransportSecurity();
        } else {
            channelBuilder.usePlaintext();
        }
        channelBuilder
                .keepAliveTime(KEEPALIVE_TIME_SECONDS, TimeUnit.SECONDS)
                .keepAliveTimeout(KEEPALIVE_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .keepAliveWithoutCalls(true)
                .idleTimeout(IDLE_TIMEOUT_MINUTES, TimeUnit.MINUTES);

        ManagedChannel channel = Objects.requireNonNull(channelBuilder.build(), "ManagedChannel");
        QdrantGrpcClient.Builder grpcClientBuilder = QdrantGrpcClient.newBuilder(channel, true);
        String apiKey = qdrant.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            grpcClientBuilder.withApiKey(apiKey);
        }
        return new QdrantClient(Objects.requireNonNull(grpcClientBuilder.build(), "QdrantGrpcClient"));
    }

    @Bean
    public VectorStoreGateway vectorStoreGateway(QdrantClient qdrantClient, AppProperties appProperties) {
        return new QdrantVectorStoreGateway(qdrantClient, appProperties.getQdrant());
    }
}
