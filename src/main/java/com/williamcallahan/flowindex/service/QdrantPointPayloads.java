package com.williamcallahan.flowindex.service;

import static io.qdrant.client.ValueFactory.value;

import com.williamcallahan.flowindex.domain.ingestion.DocumentPoint;
import com.williamcallahan.flowindex.domain.ingestion.FileType;
import com.williamcallahan.flowindex.domain.ingestion.PointMetadata;
import io.qdrant.client.grpc.JsonWithInt.Struct;
import io.qdrant.client.grpc.JsonWithInt.Value;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps chunk points to and from the Qdrant payload layout
 * {@code {page_content, metadata: {file_path, file_id, chunk_idx, ...}}}.
 */
final class QdrantPointPayloads {

    static final String PAGE_CONTENT_FIELD = "page_content";
    static final String METADATA_FIELD = "metadata";
    static final String FILE_PATH_FIELD = "file_path";
    static final String FILE_PATH_KEY = METADATA_FIELD + "." + FILE_PATH_FIELD;

    private static final String FILE_ID_FIELD = "file_id";
    private static final String CHUNK_IDX_FIELD = "chunk_idx";
    private static final String FILENAME_FIELD = "filename";
    private static final String FILE_TYPE_FIELD = "file_type";
    private static final String FLOW_ID_FIELD = "flow_id";
    private static final String INCLUDES_IMAGES_FIELD = "includes_images";
    private static final String FILE_SIZE_FIELD = "file_size";
    private static final String UPLOADED_AT_FIELD = "uploaded_at";

    private QdrantPointPayloads() {}

    static Map<String, Value> toPayload(DocumentPoint point) {
        PointMetadata metadata = point.metadata();
        Map<String, Value> metadataFields = new LinkedHashMap<>();
        metadataFields.put(FILE_PATH_FIELD, value(metadata.filePath()));
        metadataFields.put(FILE_ID_FIELD, value(metadata.fileId()));
        metadataFields.put(CHUNK_IDX_FIELD, value(metadata.chunkIdx()));
        metadataFields.put(FILENAME_FIELD, value(metadata.fileName()));
        metadataFields.put(FILE_TYPE_FIELD, value(metadata.fileType().wireName()));
        metadataFields.put(FLOW_ID_FIELD, value(metadata.flowId()));
        metadataFields.put(INCLUDES_IMAGES_FIELD, value(metadata.includesImages()));
        metadataFields.put(FILE_SIZE_FIELD, value(metadata.fileSize()));
        metadataFields.put(UPLOADED_AT_FIELD, value(metadata.uploadedAt().toString()));

        Map<String, Value> payload = new LinkedHashMap<>();
        payload.put(PAGE_CONTENT_FIELD, value(point.pageContent()));
        payload.put(
                METADATA_FIELD,
                Value.newBuilder()
                        .setStructValue(Struct.newBuilder().putAllFields(metadataFields))
                        .build());
        return payload;
    }

    /**
     * Reads chunk metadata from a payload; empty when the point was not written by this pipeline.
     */
    static Optional<PointMetadata> toMetadata(Map<String, Value> payload) {
        Value metadataValue = payload.get(METADATA_FIELD);
        if (metadataValue == null || metadataValue.getKindCase() != Value.KindCase.STRUCT_VALUE) {
            return Optional.empty();
        }
        Map<String, Value> fields = metadataValue.getStructValue().getFieldsMap();
        String filePath = string(fields, FILE_PATH_FIELD);
        if (filePath.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new PointMetadata(
                filePath,
                string(fields, FILE_ID_FIELD),
                (int) Math.max(0, number(fields, CHUNK_IDX_FIELD)),
                string(fields, FILENAME_FIELD),
                FileType.fromWireName(string(fields, FILE_TYPE_FIELD)),
                string(fields, FLOW_ID_FIELD),
                bool(fields, INCLUDES_IMAGES_FIELD),
                number(fields, FILE_SIZE_FIELD),
                instant(fields, UPLOADED_AT_FIELD)));
    }

    private static String string(Map<String, Value> fields, String key) {
        Value fieldValue = fields.get(key);
        if (fieldValue == null) {
            return "";
        }
        return switch (fieldValue.getKindCase()) {
            case STRING_VALUE -> fieldValue.getStringValue();
            case INTEGER_VALUE -> String.valueOf(fieldValue.getIntegerValue());
            default -> "";
        };
    }

    private static long number(Map<String, Value> fields, String key) {
        Value fieldValue = fields.get(key);
        if (fieldValue == null) {
            return 0L;
        }
        return switch (fieldValue.getKindCase()) {
            case INTEGER_VALUE -> fieldValue.getIntegerValue();
            case DOUBLE_VALUE -> (long) fieldValue.getDoubleValue();
            default -> 0L;
        };
    }

    private static boolean bool(Map<String, Value> fields, String key) {
        Value fieldValue = fields.get(key);
        return fieldValue != null
                && fieldValue.getKindCase() == Value.KindCase.BOOL_VALUE
                && fieldValue.getBoolValue();
    }

    private static Instant instant(Map<String, Value> fields, String key) {
        String raw = string(fields, key);
        if (raw.isBlank()) {
            return Instant.EPOCH;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException unparseable) {
            return Instant.EPOCH;
        }
    }
}
