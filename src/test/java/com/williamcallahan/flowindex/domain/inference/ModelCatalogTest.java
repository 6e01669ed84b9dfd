package com.williamcallahan.flowindex.domain.inference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ModelCatalogTest {

    @Test
    void groupsModelsByNameMarkers() {
        ModelCatalog catalog = ModelCatalog.categorize(
                List.of("mxbai-embed-large", "moondream:latest", "BakLLaVA:7b", "mistral:7b"));

        assertEquals(List.of("mxbai-embed-large"), catalog.embeddingModels());
        assertEquals(List.of("moondream:latest", "BakLLaVA:7b"), catalog.visionModels());
        assertEquals(List.of("mistral:7b"), catalog.chatModels());
        assertEquals(4, catalog.allModels().size());
    }

    @Test
    void hasModelIgnoresTagSuffix() {
        ModelCatalog catalog = ModelCatalog.categorize(List.of("llava:13b"));

        assertTrue(catalog.hasModel("llava"));
        assertTrue(catalog.hasModel("llava:latest"));
        assertFalse(catalog.hasModel("bakllava"));
        assertFalse(catalog.hasModel(" "));
    }
}
