package com.example.documents.infrastructure.persistence;

import com.example.documents.domain.model.DocumentRecord;
import com.example.documents.domain.model.NewDocument;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA mapping of the {@code documents} table created by {@code schema.sql}.
 */
@Entity
@Table(name = "documents")
public class DocumentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private String filename;

    @Column(name = "original_name", nullable = false, updatable = false)
    private String originalName;

    @Column(nullable = false, updatable = false)
    private String filepath;

    @Column(nullable = false, updatable = false)
    private long filesize;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected DocumentEntity() {
    }

    static DocumentEntity from(NewDocument document) {
        DocumentEntity entity = new DocumentEntity();
        entity.filename = document.filename();
        entity.originalName = document.originalName();
        entity.filepath = document.filepath();
        entity.filesize = document.filesize();
        entity.createdAt = document.createdAt();
        return entity;
    }

    DocumentRecord toRecord() {
        return new DocumentRecord(id, filename, originalName, filepath, filesize, createdAt);
    }

    public Long getId() {
        return id;
    }

    public String getFilename() {
        return filename;
    }

    public String getOriginalName() {
        return originalName;
    }

    public String getFilepath() {
        return filepath;
    }

    public long getFilesize() {
        return filesize;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
