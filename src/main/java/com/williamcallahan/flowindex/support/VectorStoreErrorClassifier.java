package com.williamcallahan.flowindex.support;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Classifies vector store failures as transient or permanent.
 */
public final class VectorStoreErrorClassifier {

    private static final Set<Status.Code> TRANSIENT_STATUS_CODES =
            Set.of(Status.Code.UNAVAILABLE, Status.Code.DEADLINE_EXCEEDED, Status.Code.RESOURCE_EXHAUSTED);

    private VectorStoreErrorClassifier() {}

    /**
     * Determine a stable error category based on exception messages and causes.
     *
     * @param error failure encountered while talking to the vector store
     * @return normalized error category label
     */
    public static String determineErrorType(Throwable error) {
        StringBuilder messageBuilder = new StringBuilder();
        Throwable current = error;
        while (current != null) {
            String currentMessage = current.getMessage();
            if (currentMessage != null && !currentMessage.isBlank()) {
                if (messageBuilder.length() > 0) {
                    messageBuilder.append(' ');
                }
                messageBuilder.append(currentMessage);
            }
            current = current.getCause();
        }

        String message = messageBuilder.toString().toLowerCase(Locale.ROOT);

        if (message.contains("not found") || message.contains("doesn't exist")) {
            return "Not Found";
        } else if (message.contains("unauthenticated") || message.contains("permission denied")) {
            return "Unauthorized";
        } else if (message.contains("resource exhausted") || message.contains("too many requests")) {
            return "Rate Limited";
        } else if (message.contains("connection") || message.contains("timeout") || message.contains("timed out")) {
            return "Connection Error";
        } else if (message.contains("dimension") || message.contains("vector size")) {
            return "Dimension Mismatch";
        }
        return "Unknown Error";
    }

    /**
     * Determines whether the failure is transient and the operation may be retried.
     *
     * <p>gRPC UNAVAILABLE, DEADLINE_EXCEEDED and RESOURCE_EXHAUSTED statuses, timeouts and
     * connection failures are transient. Missing collections, dimension mismatches and
     * malformed ids are not.</p>
     *
     * @param error the exception to classify
     * @return true if the error is transient
     */
    public static boolean isTransientVectorStoreError(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof StatusRuntimeException statusException) {
                return TRANSIENT_STATUS_CODES.contains(statusException.getStatus().getCode());
            }
            if (current instanceof TimeoutException) {
                return true;
            }
            if (current instanceof IllegalArgumentException) {
                return false;
            }
            current = current.getCause();
        }
        String errorType = determineErrorType(error);
        return "Connection Error".equals(errorType) || "Rate Limited".equals(errorType);
    }
}
