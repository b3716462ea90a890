package com.example.documents.domain.exception;

/**
 * Raised when the client uploads an empty file.
 */
public class PdfFileRequiredException extends DocumentValidationException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public PdfFileRequiredException() {
        super("Empty file not allowed.");
    }
}
