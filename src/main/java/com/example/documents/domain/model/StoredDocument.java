package com.example.documents.domain.model;

/**
 * Blob content paired with the record that describes it, as returned by a download.
 */
public record StoredDocument(byte[] content, DocumentRecord record) {
}
