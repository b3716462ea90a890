package com.example.documents.interfaces.api;

import com.example.documents.application.service.DocumentService;
import com.example.documents.domain.model.DocumentRecord;
import com.example.documents.domain.model.StoredDocument;
import com.example.documents.interfaces.api.dto.DocumentListResponse;
import com.example.documents.interfaces.api.dto.DocumentResponse;
import com.example.documents.interfaces.api.dto.MessageResponse;
import com.example.documents.interfaces.api.dto.UploadResponse;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;

/**
 * Interfaces-layer REST controller exposing upload, list, download and delete.
 * Failures are translated by {@link com.example.documents.interfaces.api.error.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/documents")
public class DocumentController {

    private final DocumentService documentService;

    /**
     * @param documentService facade over the blob and metadata stores
     */
    public DocumentController(DocumentService documentService) {
        this.documentService = documentService;
    }

    /**
     * Accepts a PDF upload.
     *
     * @param document multipart file part named {@code document}
     * @return the created record
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<UploadResponse> upload(@RequestParam("document") MultipartFile document) {
        DocumentRecord record = documentService.upload(document);
        return ResponseEntity.ok(new UploadResponse("Document uploaded successfully", DocumentResponse.from(record)));
    }

    /**
     * @return metadata of every stored document, newest first
     */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DocumentListResponse> list() {
        return ResponseEntity.ok(new DocumentListResponse(
                documentService.list().stream().map(DocumentResponse::from).toList()));
    }

    /**
     * Streams the stored PDF as an attachment named after the original upload.
     *
     * @param id document identifier
     * @return PDF bytes
     */
    @GetMapping("/{id}")
    public ResponseEntity<byte[]> download(@PathVariable("id") long id) {
        StoredDocument stored = documentService.getBlob(id);
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(stored.record().originalName(), StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(MediaType.APPLICATION_PDF)
                .contentLength(stored.content().length)
                .body(stored.content());
    }

    @DeleteMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MessageResponse> delete(@PathVariable("id") long id) {
        documentService.delete(id);
        return ResponseEntity.ok(new MessageResponse("Document deleted successfully"));
    }
}
