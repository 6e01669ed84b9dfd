package com.williamcallahan.flowindex.service.ingestion;

import java.util.Objects;

/**
 * Transition table for ingestion jobs.
 *
 * <p>Jobs move strictly forward; {@link IngestionEvent#ERROR} moves any running state to
 * {@link IngestionState#FAILED}. Terminal states accept no event.</p>
 */
public final class IngestionTransitions {

    private IngestionTransitions() {}

    /**
     * Computes the state that follows {@code event} in {@code state}.
     *
     * @throws IllegalStateException when the event is not legal in that state
     */
    public static IngestionState next(IngestionState state, IngestionEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");
        if (state.isTerminal()) {
            throw illegal(state, event);
        }
        if (event == IngestionEvent.ERROR) {
            return IngestionState.FAILED;
        }
        IngestionState expectedFrom = switch (event) {
            case START -> IngestionState.ACCEPTED;
            case CONTENT_EXTRACTED -> IngestionState.READING_FILE;
            case CHUNKS_CREATED -> IngestionState.CREATING_CHUNKS;
            case EMBEDDINGS_GENERATED -> IngestionState.GENERATING_EMBEDDINGS;
            case UPSERTED -> IngestionState.UPLOADING;
            case ERROR -> throw new AssertionError(event);
        };
        if (state != expectedFrom) {
            throw illegal(state, event);
        }
        return IngestionState.values()[state.ordinal() + 1];
    }

    private static IllegalStateException illegal(IngestionState state, IngestionEvent event) {
        return new IllegalStateException("Illegal ingestion transition: " + event + " in state " + state);
    }
}
