package com.williamcallahan.flowindex.domain.ingestion;

import java.util.Objects;
import java.util.Optional;

/**
 * Identifies the vector store collection that holds one flow's documents.
 *
 * <p>Collections are named after the flow id. When a user id is present the name becomes
 * {@code <userId>_<flowId>} so two users can own flows with the same id.</p>
 *
 * @param userId optional owning user, {@code null} or blank when the flow is not user-scoped
 * @param flowId flow identifier, never blank
 */
public record CollectionScope(String userId, String flowId) {

    private static final char USER_SEPARATOR = '_';

    /**
     * Validates the flow id and normalizes a blank user id to {@code null}.
     */
    public CollectionScope {
        Objects.requireNonNull(flowId, "flowId");
        if (flowId.isBlank()) {
            throw new IllegalArgumentException("flowId must not be blank");
        }
        if (flowId.indexOf('/') >= 0 || flowId.indexOf('\\') >= 0) {
            throw new IllegalArgumentException("flowId must not contain path separators: " + flowId);
        }
        userId = userId == null || userId.isBlank() ? null : userId.trim();
        flowId = flowId.trim();
    }

    /**
     * Creates a scope for a flow that is not tied to a user.
     *
     * @param flowId flow identifier
     * @return flow-only scope
     */
    public static CollectionScope forFlow(String flowId) {
        return new CollectionScope(null, flowId);
    }

    /**
     * Creates a scope for a user-owned flow.
     *
     * @param userId owning user id
     * @param flowId flow identifier
     * @return user-scoped collection scope
     */
    public static CollectionScope forUser(String userId, String flowId) {
        return new CollectionScope(userId, flowId);
    }

    public Optional<String> optionalUserId() {
        return Optional.ofNullable(userId);
    }

    /**
     * Returns the vector store collection name for this scope.
     */
    public String collectionName() {
        return userId == null ? flowId : userId + USER_SEPARATOR + flowId;
    }
}
