package com.example.documents.domain.exception;

/**
 * Raised when no metadata record exists for the requested document id.
 */
public class DocumentNotFoundException extends DomainException {

	/**
	 * Creates the exception and records the missing id as part of the message.
	 *
	 * @param id identifier that could not be resolved
	 */
    public DocumentNotFoundException(long id) {
        super("Document not found: " + id);
    }

    protected DocumentNotFoundException(String message) {
        super(message);
    }
}
