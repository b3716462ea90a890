package com.example.documents.domain.exception;

/**
 * Raised when the uploaded content exceeds the configured maximum size.
 */
public class PdfFileTooLargeException extends DocumentValidationException {

    private static final long MEGABYTE = 1024L * 1024L;

	/**
	 * @param maxBytes the limit that was exceeded, in bytes
	 */
    public PdfFileTooLargeException(long maxBytes) {
        super("File size exceeds " + describe(maxBytes) + " limit.");
    }

    private static String describe(long maxBytes) {
        if (maxBytes >= MEGABYTE && maxBytes % MEGABYTE == 0) {
            return (maxBytes / MEGABYTE) + "MB";
        }
        return maxBytes + " bytes";
    }
}
