package com.williamcallahan.flowindex.service.ingestion;

import com.williamcallahan.flowindex.service.InferenceTimeoutException;
import com.williamcallahan.flowindex.service.IngestionException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Service;

/**
 * Turns a job failure into the reason text recorded on its tracker entry.
 */
@Service
public class IngestionFailureDescriber {

    private static final Map<Class<? extends Throwable>, String> HINTS = new ConcurrentHashMap<>();

    static {
        register(java.io.FileNotFoundException.class, "file not found or inaccessible");
        register(java.nio.file.AccessDeniedException.class, "permission denied");
        register(java.nio.charset.MalformedInputException.class, "file encoding issue - not valid UTF-8");
        register(java.nio.file.NoSuchFileException.class, "file does not exist");
        register(InferenceTimeoutException.class, "inference service did not answer in time");
    }

    static void register(Class<? extends Throwable> exceptionType, String hint) {
        HINTS.put(exceptionType, hint);
    }

    /**
     * Formats {@code SimpleName: message [hint]}, where the hint comes from the registered table,
     * the cause type, or the retriable flag of pipeline failures.
     *
     * @param failure the exception that ended the job
     * @return single-line reason
     */
    public String describe(Throwable failure) {
        Objects.requireNonNull(failure, "failure");

        StringBuilder details = new StringBuilder();
        details.append(failure.getClass().getSimpleName());

        String message = failure.getMessage();
        if (message != null && !message.isBlank()) {
            details.append(": ").append(message);
        }

        String diagnosticHint = HINTS.get(failure.getClass());
        if (diagnosticHint != null) {
            details.append(" [").append(diagnosticHint).append("]");
        } else if (failure.getCause() != null) {
            details.append(" [caused by: ")
                    .append(failure.getCause().getClass().getSimpleName())
                    .append("]");
        } else if (failure instanceof IngestionException pipelineFailure && pipelineFailure.isRetriable()) {
            details.append(" [retriable]");
        }
        return details.toString();
    }
}
