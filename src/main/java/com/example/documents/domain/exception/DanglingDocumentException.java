package com.example.documents.domain.exception;

/**
 * Raised when a metadata record exists but its blob is no longer on disk.
 * Extends {@link DocumentNotFoundException} so transports report it as not-found,
 * while callers that care can still tell a dangling record from an unknown id.
 */
public class DanglingDocumentException extends DocumentNotFoundException {

    private final long documentId;

	/**
	 * @param id identifier of the record whose blob is missing
	 */
    public DanglingDocumentException(long id) {
        super("File not found on disk for document: " + id);
        this.documentId = id;
    }

    public long getDocumentId() {
        return documentId;
    }
}
