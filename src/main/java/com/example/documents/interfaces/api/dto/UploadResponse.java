package com.example.documents.interfaces.api.dto;

/**
 * Body returned after a successful upload.
 */
public record UploadResponse(String message, DocumentResponse document) {
}
