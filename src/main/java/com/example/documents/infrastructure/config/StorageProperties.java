package com.example.documents.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

/**
 * Configuration for the blob store and upload limits.
 *
 * @param uploadDir   directory holding one file per document
 * @param maxFileSize largest accepted upload
 */
@ConfigurationProperties(prefix = "documents.storage")
public record StorageProperties(
        @DefaultValue("uploads") String uploadDir,
        @DefaultValue("10MB") DataSize maxFileSize
) {
    public StorageProperties {
        if (uploadDir == null || uploadDir.isBlank()) {
            throw new IllegalArgumentException("documents.storage.upload-dir must not be blank");
        }
        if (maxFileSize == null || maxFileSize.toBytes() <= 0) {
            throw new IllegalArgumentException("documents.storage.max-file-size must be positive");
        }
    }
}
