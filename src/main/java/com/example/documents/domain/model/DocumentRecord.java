package com.example.documents.domain.model;

import java.time.Instant;

/**
 * Metadata describing one stored PDF.
 * Records are immutable; the only lifecycle transitions are creation by an upload and removal by a delete.
 *
 * @param id           identifier assigned by the metadata store, never reused
 * @param filename     collision-free name of the blob inside the blob store
 * @param originalName name supplied by the client, used for display and download headers only
 * @param filepath     location of the blob as reported by the blob store
 * @param filesize     byte length measured at upload time
 * @param createdAt    creation timestamp
 */
public record DocumentRecord(
        long id,
        String filename,
        String originalName,
        String filepath,
        long filesize,
        Instant createdAt
) {
}
