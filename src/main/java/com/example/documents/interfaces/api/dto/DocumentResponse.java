package com.example.documents.interfaces.api.dto;

import com.example.documents.domain.model.DocumentRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Client view of a document. {@code filename} carries the original name; storage details stay internal.
 */
public record DocumentResponse(
        long id,
        String filename,
        long filesize,
        @JsonProperty("created_at") Instant createdAt
) {
    public static DocumentResponse from(DocumentRecord record) {
        return new DocumentResponse(record.id(), record.originalName(), record.filesize(), record.createdAt());
    }
}
