package com.example.documents.infrastructure.config;

import com.example.documents.application.service.PdfUploadValidator;
import com.example.documents.domain.store.BlobStore;
import com.example.documents.infrastructure.storage.FileSystemBlobStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the blob store, the upload validator and the clock used to stamp new records.
 */
@Configuration
@EnableConfigurationProperties(StorageProperties.class)
public class StorageConfiguration {

    @Bean
    public BlobStore blobStore(StorageProperties properties) {
        return new FileSystemBlobStore(Path.of(properties.uploadDir()));
    }

    @Bean
    public PdfUploadValidator pdfUploadValidator(StorageProperties properties) {
        return new PdfUploadValidator(properties.maxFileSize().toBytes());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
