package com.example.documents.infrastructure.exception;

/**
 * Signals a failed read, write or delete against the blob store or the metadata store.
 * The message may contain internal paths and is meant for logs, not for clients.
 */
public class StorageException extends InfrastructureException {

	/**
	 * @param message description of the failed operation
	 * @param cause   underlying I/O or data access exception
	 */
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
