package com.example.documents.infrastructure.persistence;

import com.example.documents.domain.model.DocumentRecord;
import com.example.documents.domain.model.NewDocument;
import com.example.documents.domain.store.DocumentMetadataStore;
import com.example.documents.infrastructure.exception.StorageException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * {@link DocumentMetadataStore} backed by the relational {@code documents} table.
 * Every Spring {@link DataAccessException} is translated into a {@link StorageException}.
 */
@Repository
public class JpaDocumentMetadataStore implements DocumentMetadataStore {

    private final DocumentEntityRepository repository;

    public JpaDocumentMetadataStore(DocumentEntityRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional
    public DocumentRecord insert(NewDocument document) {
        try {
            return repository.saveAndFlush(DocumentEntity.from(document)).toRecord();
        } catch (DataAccessException e) {
            throw new StorageException("Unable to insert metadata for " + document.filename(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<DocumentRecord> findAllNewestFirst() {
        try {
            return repository.findAllByOrderByCreatedAtDescIdDesc().stream()
                    .map(DocumentEntity::toRecord)
                    .toList();
        } catch (DataAccessException e) {
            throw new StorageException("Unable to list document metadata", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DocumentRecord> findById(long id) {
        try {
            return repository.findById(id).map(DocumentEntity::toRecord);
        } catch (DataAccessException e) {
            throw new StorageException("Unable to load metadata for document " + id, e);
        }
    }

    @Override
    @Transactional
    public boolean deleteById(long id) {
        try {
            return repository.deleteRowById(id) > 0;
        } catch (DataAccessException e) {
            throw new StorageException("Unable to delete metadata for document " + id, e);
        }
    }
}
