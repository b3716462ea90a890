package com.example.documents.domain.model;

import java.time.Instant;

/**
 * Metadata for a document whose blob has been written but whose row does not exist yet.
 */
public record NewDocument(
        String filename,
        String originalName,
        String filepath,
        long filesize,
        Instant createdAt
) {
}
