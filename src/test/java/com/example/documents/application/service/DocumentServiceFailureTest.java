package com.example.documents.application.service;

import com.example.documents.domain.exception.DocumentNotFoundException;
import com.example.documents.domain.model.DocumentRecord;
import com.example.documents.domain.model.NewDocument;
import com.example.documents.domain.store.BlobStore;
import com.example.documents.domain.store.DocumentMetadataStore;
import com.example.documents.infrastructure.exception.StorageException;
import com.example.documents.support.TestPdfs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;

/**
 * Covers how the facade sequences the two stores when one of them fails.
 */
@ExtendWith(MockitoExtension.class)
class DocumentServiceFailureTest {

    private static final Instant NOW = Instant.parse("2024-05-01T09:00:00Z");
    private static final String LOCATION = "/data/uploads/blob.pdf";

    @Mock
    private DocumentMetadataStore metadataStore;

    @Mock
    private BlobStore blobStore;

    private DocumentService service;
    private byte[] pdf;

    @BeforeEach
    void setUp() throws IOException {
        service = new DocumentService(metadataStore, blobStore, new PdfUploadValidator(1024 * 1024),
                Clock.fixed(NOW, ZoneOffset.UTC));
        pdf = TestPdfs.createPdf("Failure cases");
    }

    @Test
    void blobWriteFailureCreatesNoRecord() {
        given(blobStore.write(anyString(), any(byte[].class)))
                .willThrow(new StorageException("disk full", new IOException("No space left on device")));

        assertThatThrownBy(() -> service.upload(new ByteArrayInputStream(pdf), "a.pdf", pdf.length))
                .isInstanceOf(StorageException.class);

        then(metadataStore).should(never()).insert(any());
    }

    /**
     * A failed insert removes the blob that was just written, then reports the storage failure.
     */
    @Test
    void metadataInsertFailureRemovesWrittenBlob() {
        StorageException failure = new StorageException("insert failed", new RuntimeException("db down"));
        given(blobStore.write(anyString(), any(byte[].class))).willReturn(LOCATION);
        given(metadataStore.insert(any(NewDocument.class))).willThrow(failure);

        assertThatThrownBy(() -> service.upload(new ByteArrayInputStream(pdf), "a.pdf", pdf.length))
                .isSameAs(failure);

        then(blobStore).should().delete(LOCATION);
    }

    @Test
    void unexpectedInsertFailureIsWrappedAsStorageError() {
        given(blobStore.write(anyString(), any(byte[].class))).willReturn(LOCATION);
        given(metadataStore.insert(any(NewDocument.class))).willThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> service.upload(new ByteArrayInputStream(pdf), "a.pdf", pdf.length))
                .isInstanceOf(StorageException.class)
                .hasCauseInstanceOf(IllegalStateException.class);

        then(blobStore).should().delete(LOCATION);
    }

    @Test
    void failedCleanupIsSuppressedIntoTheOriginalError() {
        StorageException failure = new StorageException("insert failed", new RuntimeException("db down"));
        StorageException cleanupFailure = new StorageException("delete failed", new IOException("busy"));
        given(blobStore.write(anyString(), any(byte[].class))).willReturn(LOCATION);
        given(metadataStore.insert(any(NewDocument.class))).willThrow(failure);
        given(blobStore.delete(LOCATION)).willThrow(cleanupFailure);

        assertThatThrownBy(() -> service.upload(new ByteArrayInputStream(pdf), "a.pdf", pdf.length))
                .isSameAs(failure);

        assertThat(failure.getSuppressed()).containsExactly(cleanupFailure);
    }

    @Test
    void insertCarriesMeasuredSizeAndClockTime() {
        given(blobStore.write(anyString(), any(byte[].class))).willReturn(LOCATION);
        given(metadataStore.insert(any(NewDocument.class))).willAnswer(invocation -> {
            NewDocument document = invocation.getArgument(0);
            return new DocumentRecord(7, document.filename(), document.originalName(),
                    document.filepath(), document.filesize(), document.createdAt());
        });

        DocumentRecord record = service.upload(new ByteArrayInputStream(pdf), "a.pdf", 1);

        assertThat(record.filesize()).isEqualTo(pdf.length);
        assertThat(record.createdAt()).isEqualTo(NOW);
        assertThat(record.filepath()).isEqualTo(LOCATION);
    }

    @Test
    void blobDeleteFailureStillRemovesRecord() {
        given(metadataStore.findById(5)).willReturn(Optional.of(record(5)));
        willThrow(new StorageException("permission denied", new IOException("EACCES")))
                .given(blobStore).delete(LOCATION);
        given(metadataStore.deleteById(5)).willReturn(true);

        service.delete(5);

        then(metadataStore).should().deleteById(5);
    }

    @Test
    void metadataDeleteFailureLeavesDanglingRecordAndSurfacesStorageError() {
        given(metadataStore.findById(5)).willReturn(Optional.of(record(5)));
        given(blobStore.delete(LOCATION)).willReturn(true);
        given(metadataStore.deleteById(5)).willThrow(new StorageException("delete failed", new RuntimeException()));

        assertThatThrownBy(() -> service.delete(5)).isInstanceOf(StorageException.class);

        then(blobStore).should().delete(LOCATION);
    }

    /**
     * A concurrent delete that removed the row between lookup and removal is reported as not-found.
     */
    @Test
    void rowRemovedConcurrentlyIsNotFound() {
        given(metadataStore.findById(5)).willReturn(Optional.of(record(5)));
        given(blobStore.delete(LOCATION)).willReturn(false);
        given(metadataStore.deleteById(5)).willReturn(false);

        assertThatThrownBy(() -> service.delete(5)).isInstanceOf(DocumentNotFoundException.class);
    }

    @Test
    void deleteOfUnknownIdTouchesNoStore() {
        given(metadataStore.findById(9)).willReturn(Optional.empty());

        assertThatThrownBy(() -> service.delete(9)).isInstanceOf(DocumentNotFoundException.class);

        then(blobStore).shouldHaveNoInteractions();
        then(metadataStore).should(never()).deleteById(eq(9L));
    }

    private DocumentRecord record(long id) {
        return new DocumentRecord(id, "blob.pdf", "original.pdf", LOCATION, 10, NOW);
    }
}
