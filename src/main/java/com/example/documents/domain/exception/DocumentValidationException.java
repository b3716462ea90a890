package com.example.documents.domain.exception;

/**
 * Raised when an upload is rejected before either store is touched.
 * Messages are shown to the client as-is, so they must tell the user what to fix.
 */
public abstract class DocumentValidationException extends DomainException {

    protected DocumentValidationException(String message) {
        super(message);
    }
}
