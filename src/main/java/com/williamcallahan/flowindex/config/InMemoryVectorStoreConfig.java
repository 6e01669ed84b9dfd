package com.williamcallahan.flowindex.config;

import com.williamcallahan.flowindex.service.VectorStoreGateway;
import com.williamcallahan.flowindex.vectorstore.InMemoryVectorStoreGateway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Process-local vector store for development runs without a Qdrant instance.
 */
@Configuration
@ConditionalOnProperty(name = "app.vector-store.provider", havingValue = "memory")
public class InMemoryVectorStoreConfig {

    @Bean
    public VectorStoreGateway vectorStoreGateway() {
        return new InMemoryVectorStoreGateway();
    }
}
