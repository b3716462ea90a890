package com.example.documents.domain.store;

import java.util.Optional;

/**
 * Holds raw document content, one item per document.
 * Implementations throw {@code StorageException} for I/O failures other than a missing item.
 */
public interface BlobStore {

    /**
     * Writes the content under the given storage name.
     *
     * @param filename collision-free storage name
     * @param content  bytes to persist
     * @return location of the written blob, later passed back to {@link #read} and {@link #delete}
     */
    String write(String filename, byte[] content);

    /**
     * @param location location previously returned by {@link #write}
     * @return the content, or empty when nothing is stored at that location
     */
    Optional<byte[]> read(String location);

    /**
     * Removes the blob.
     *
     * @param location location previously returned by {@link #write}
     * @return {@code true} when a blob was removed, {@code false} when it was already gone
     */
    boolean delete(String location);
}
