package com.example.documents.domain.store;

import com.example.documents.domain.model.DocumentRecord;
import com.example.documents.domain.model.NewDocument;

import java.util.List;
import java.util.Optional;

/**
 * Structured store holding one row per document.
 * Identifier generation is delegated to the implementation.
 */
public interface DocumentMetadataStore {

    DocumentRecord insert(NewDocument document);

    /**
     * @return every record, most recently created first
     */
    List<DocumentRecord> findAllNewestFirst();

    Optional<DocumentRecord> findById(long id);

    /**
     * @return {@code true} when a row was removed
     */
    boolean deleteById(long id);
}
