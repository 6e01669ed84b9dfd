package com.williamcallahan.flowindex.domain.ingestion;

/**
 * Acknowledgment returned once an ingestion job is queued.
 *
 * @param fileId tracked job key
 * @param fileName original file name
 * @param collectionName target collection
 * @param fileType detected type
 * @param status initial tracker status
 */
public record IngestionAccepted(
        String fileId, String fileName, String collectionName, FileType fileType, ProcessingStatus status) {}
