package com.example.documents.application.service;

import com.example.documents.domain.exception.DanglingDocumentException;
import com.example.documents.domain.exception.DocumentNotFoundException;
import com.example.documents.domain.exception.DocumentValidationException;
import com.example.documents.domain.model.DocumentRecord;
import com.example.documents.domain.model.NewDocument;
import com.example.documents.domain.model.StoredDocument;
import com.example.documents.domain.store.BlobStore;
import com.example.documents.domain.store.DocumentMetadataStore;
import com.example.documents.infrastructure.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Application-layer facade over the blob store and the metadata store.
 * <p>
 * The two stores are not updated atomically. Uploads write the blob first and the row second;
 * deletes remove the blob first and the row second. The failure handling of each step is:
 * <ul>
 *     <li>upload, blob write fails: nothing is recorded, {@link StorageException} is raised;</li>
 *     <li>upload, row insert fails: the written blob is removed on a best-effort basis, then
 *     {@link StorageException} is raised;</li>
 *     <li>delete, blob removal fails or the blob is already gone: logged, the row is removed anyway;</li>
 *     <li>delete, row removal fails: the row stays and points at a missing blob, which
 *     {@link #getBlob(long)} reports as {@link DanglingDocumentException}.</li>
 * </ul>
 * Partial failures are never reconciled automatically.
 */
@Service
public class DocumentService {

    private static final Logger log = LoggerFactory.getLogger(DocumentService.class);
    private static final String STORAGE_EXTENSION = ".pdf";

    private final DocumentMetadataStore metadataStore;
    private final BlobStore blobStore;
    private final PdfUploadValidator validator;
    private final Clock clock;

    /**
     * Creates the facade with explicit references to both stores.
     *
     * @param metadataStore store holding one row per document
     * @param blobStore     store holding one file per document
     * @param validator     upload gatekeeper
     * @param clock         source of creation timestamps
     */
    public DocumentService(DocumentMetadataStore metadataStore,
                           BlobStore blobStore,
                           PdfUploadValidator validator,
                           Clock clock) {
        this.metadataStore = metadataStore;
        this.blobStore = blobStore;
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * Stores an uploaded multipart file.
     *
     * @param file uploaded PDF
     * @return the created record
     * @see #upload(InputStream, String, long)
     */
    public DocumentRecord upload(MultipartFile file) {
        try (InputStream content = file.getInputStream()) {
            return upload(content, file.getOriginalFilename(), file.getSize());
        } catch (IOException e) {
            throw new StorageException("Unable to read uploaded file", e);
        }
    }

    /**
     * Validates and stores a new document.
     *
     * @param content      upload stream, not closed by this method
     * @param originalName client-supplied file name
     * @param declaredSize size claimed by the client; informational only, the measured length is recorded
     * @return the created record with its assigned id
     * @throws DocumentValidationException when the upload is rejected; neither store is touched
     * @throws StorageException            when the blob or the row cannot be written
     */
    public DocumentRecord upload(InputStream content, String originalName, long declaredSize) {
        byte[] bytes = validator.validate(content, originalName);
        if (declaredSize >= 0 && declaredSize != bytes.length) {
            log.debug("Declared size {} differs from received size {} for '{}'", declaredSize, bytes.length, originalName);
        }

        String filename = UUID.randomUUID() + STORAGE_EXTENSION;
        String location = blobStore.write(filename, bytes);

        DocumentRecord record;
        try {
            record = metadataStore.insert(new NewDocument(filename, originalName, location, bytes.length, clock.instant()));
        } catch (RuntimeException e) {
            discardBlob(location, e);
            throw e instanceof StorageException storageException
                    ? storageException
                    : new StorageException("Unable to record metadata for " + filename, e);
        }

        log.info("Stored document {} ('{}', {} bytes)", record.id(), originalName, record.filesize());
        return record;
    }

    /**
     * @return every record, most recently created first; empty when nothing is stored
     */
    public List<DocumentRecord> list() {
        return metadataStore.findAllNewestFirst();
    }

    /**
     * Loads a document together with its content.
     *
     * @param id document identifier
     * @return content and metadata
     * @throws DocumentNotFoundException  when no record exists
     * @throws DanglingDocumentException  when the record exists but its blob is missing
     */
    public StoredDocument getBlob(long id) {
        DocumentRecord record = metadataStore.findById(id)
                .orElseThrow(() -> new DocumentNotFoundException(id));
        byte[] content = blobStore.read(record.filepath())
                .orElseThrow(() -> {
                    log.warn("Document {} references a missing blob", id);
                    return new DanglingDocumentException(id);
                });
        return new StoredDocument(content, record);
    }

    /**
     * Removes a document's blob and then its record.
     *
     * @param id document identifier
     * @throws DocumentNotFoundException when no record exists; nothing is changed
     * @throws StorageException          when the row cannot be removed
     */
    public void delete(long id) {
        DocumentRecord record = metadataStore.findById(id)
                .orElseThrow(() -> new DocumentNotFoundException(id));

        try {
            if (!blobStore.delete(record.filepath())) {
                log.warn("Blob for document {} was already missing", id);
            }
        } catch (StorageException e) {
            log.warn("Unable to delete blob for document {}, removing its record anyway", id, e);
        }

        if (!metadataStore.deleteById(id)) {
            throw new DocumentNotFoundException(id);
        }
        log.info("Deleted document {} ('{}')", id, record.originalName());
    }

    private void discardBlob(String location, RuntimeException cause) {
        try {
            blobStore.delete(location);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.warn("Unable to remove orphaned blob {}", location, e);
        }
    }
}
