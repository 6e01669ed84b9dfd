package com.williamcallahan.flowindex.domain.inference;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Models advertised by the inference service, grouped by capability.
 *
 * @param allModels every advertised model name in service order
 * @param embeddingModels names containing "embed"
 * @param visionModels known multimodal families
 * @param chatModels everything else
 */
public record ModelCatalog(
        List<String> allModels, List<String> embeddingModels, List<String> visionModels, List<String> chatModels) {

    private static final String EMBEDDING_MARKER = "embed";
    private static final Set<String> VISION_FAMILIES = Set.of("llava", "bakllava", "moondream");

    public ModelCatalog {
        allModels = List.copyOf(Objects.requireNonNull(allModels, "allModels"));
        embeddingModels = List.copyOf(Objects.requireNonNull(embeddingModels, "embeddingModels"));
        visionModels = List.copyOf(Objects.requireNonNull(visionModels, "visionModels"));
        chatModels = List.copyOf(Objects.requireNonNull(chatModels, "chatModels"));
    }

    /**
     * Categorizes raw model names.
     *
     * @param modelNames names as returned by the service, e.g. {@code llava:13b}
     * @return grouped catalog
     */
    public static ModelCatalog categorize(List<String> modelNames) {
        Objects.requireNonNull(modelNames, "modelNames");
        List<String> embedding = new ArrayList<>();
        List<String> vision = new ArrayList<>();
        List<String> chat = new ArrayList<>();
        for (String modelName : modelNames) {
            String lower = modelName.toLowerCase(Locale.ROOT);
            if (lower.contains(EMBEDDING_MARKER)) {
                embedding.add(modelName);
            } else if (VISION_FAMILIES.stream().anyMatch(lower::contains)) {
                vision.add(modelName);
            } else {
                chat.add(modelName);
            }
        }
        return new ModelCatalog(modelNames, embedding, vision, chat);
    }

    /**
     * Returns true if any advertised model matches {@code modelName}, ignoring a {@code :tag} suffix.
     */
    public boolean hasModel(String modelName) {
        if (modelName == null || modelName.isBlank()) {
            return false;
        }
        String wanted = baseName(modelName);
        return allModels.stream().anyMatch(advertised -> baseName(advertised).equals(wanted));
    }

    private static String baseName(String modelName) {
        String lower = modelName.trim().toLowerCase(Locale.ROOT);
        int tagIndex = lower.indexOf(':');
        return tagIndex < 0 ? lower : lower.substring(0, tagIndex);
    }
}
