package com.williamcallahan.flowindex;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import com.williamcallahan.flowindex.service.VectorStoreGateway;
import com.williamcallahan.flowindex.vectorstore.InMemoryVectorStoreGateway;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
        "app.vector-store.provider=memory",
        "app.ingestion.upload-dir=${java.io.tmpdir}/flow-index-context-test",
        "app.inference.server-url=http://127.0.0.1:9"
})
class FlowIndexApplicationTests {

    @Autowired
    private VectorStoreGateway vectorStoreGateway;

    @Test
    void contextLoads() {
        assertInstanceOf(InMemoryVectorStoreGateway.class, vectorStoreGateway);
    }

}
