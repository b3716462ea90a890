package com.example.documents.domain.exception;

/**
 * Raised when the uploaded file is not a PDF, either by name or by its leading bytes.
 */
public class UnsupportedPdfFormatException extends DocumentValidationException {

	/**
	 * Creates the exception and mentions the offending file so the user can react.
	 *
	 * @param fileName original file name supplied by the client, may be {@code null}
	 */
    public UnsupportedPdfFormatException(String fileName) {
        super("Only PDF files are allowed" + (fileName != null && !fileName.isBlank() ? ": " + fileName : "."));
    }
}
