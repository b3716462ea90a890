package com.example.documents.infrastructure.storage;

import com.example.documents.domain.store.BlobStore;
import com.example.documents.infrastructure.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * {@link BlobStore} that keeps each document as a single file inside one directory.
 * Locations handed out are absolute paths so records stay valid if the working directory changes.
 */
public class FileSystemBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemBlobStore.class);

    private final Path rootDirectory;

    /**
     * Creates the store and makes sure the root directory exists.
     *
     * @param rootDirectory directory holding the blobs
     * @throws StorageException when the directory cannot be created
     */
    public FileSystemBlobStore(Path rootDirectory) {
        this.rootDirectory = rootDirectory.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.rootDirectory);
        } catch (IOException e) {
            throw new StorageException("Unable to create upload directory " + this.rootDirectory, e);
        }
        log.info("Blob store directory: {}", this.rootDirectory);
    }

    public Path getRootDirectory() {
        return rootDirectory;
    }

    @Override
    public String write(String filename, byte[] content) {
        Path target = resolve(filename);
        try {
            // CREATE_NEW: a storage name is never written twice
            Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StorageException("Unable to write blob " + target, e);
        }
        return target.toString();
    }

    @Override
    public Optional<byte[]> read(String location) {
        Path path = Path.of(location);
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Unable to read blob " + path, e);
        }
    }

    @Override
    public boolean delete(String location) {
        Path path = Path.of(location);
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new StorageException("Unable to delete blob " + path, e);
        }
    }

    /**
     * Resolves a storage name inside the root directory, refusing anything that would escape it.
     */
    private Path resolve(String filename) {
        Path target = rootDirectory.resolve(filename).normalize();
        if (!rootDirectory.equals(target.getParent())) {
            throw new IllegalArgumentException("Invalid storage name: " + filename);
        }
        return target;
    }
}
