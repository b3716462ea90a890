package com.example.documents.application.service;

import com.example.documents.domain.exception.PdfFileRequiredException;
import com.example.documents.domain.exception.PdfFileTooLargeException;
import com.example.documents.domain.exception.UnsupportedPdfFormatException;
import com.example.documents.infrastructure.exception.StorageException;
import org.apache.tika.Tika;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;

/**
 * Gatekeeper for uploads: checks the file name, the content size and the PDF signature.
 * <p>
 * Content is read through a bounded buffer of {@code maxBytes + 1} bytes, so an oversized upload is
 * rejected without ever holding more than that in memory. When several checks fail, the format
 * problem is reported before the size problem.
 */
public class PdfUploadValidator {

    private static final String PDF_EXTENSION = ".pdf";
    private static final String PDF_MEDIA_TYPE = "application/pdf";
    private static final byte[] PDF_SIGNATURE = "%PDF-".getBytes(StandardCharsets.US_ASCII);
    private static final int SNIFF_LENGTH = 1024;
    private static final int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8;

    private final long maxBytes;
    private final Tika tika = new Tika();

    /**
     * @param maxBytes largest accepted content length in bytes
     */
    public PdfUploadValidator(long maxBytes) {
        if (maxBytes <= 0 || maxBytes >= MAX_ARRAY_LENGTH) {
            throw new IllegalArgumentException("maxBytes out of range: " + maxBytes);
        }
        this.maxBytes = maxBytes;
    }

    /**
     * Validates an upload and returns its content.
     *
     * @param content      upload stream; read at most {@code maxBytes + 1} bytes, not closed
     * @param originalName client-supplied file name
     * @return the complete content of a valid upload
     * @throws UnsupportedPdfFormatException when the name or the leading bytes are not PDF
     * @throws PdfFileRequiredException      when the content is empty
     * @throws PdfFileTooLargeException      when the content exceeds {@code maxBytes}
     * @throws StorageException              when the upload stream cannot be read
     */
    public byte[] validate(InputStream content, String originalName) {
        if (!hasPdfExtension(originalName)) {
            throw new UnsupportedPdfFormatException(originalName);
        }
        byte[] bytes = readBounded(content);
        if (bytes.length == 0) {
            throw new PdfFileRequiredException();
        }
        if (!hasPdfSignature(bytes)) {
            throw new UnsupportedPdfFormatException(originalName);
        }
        if (bytes.length > maxBytes) {
            throw new PdfFileTooLargeException(maxBytes);
        }
        return bytes;
    }

    /**
     * Case-insensitive {@code .pdf} suffix check.
     */
    boolean hasPdfExtension(String fileName) {
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(PDF_EXTENSION);
    }

    /**
     * Requires {@code %PDF-} at offset 0, then confirms the type with Tika's magic detection.
     * Any name or declared type is ignored.
     */
    boolean hasPdfSignature(byte[] bytes) {
        if (bytes.length < PDF_SIGNATURE.length
                || !Arrays.equals(bytes, 0, PDF_SIGNATURE.length, PDF_SIGNATURE, 0, PDF_SIGNATURE.length)) {
            return false;
        }
        byte[] prefix = bytes.length > SNIFF_LENGTH ? Arrays.copyOf(bytes, SNIFF_LENGTH) : bytes;
        return PDF_MEDIA_TYPE.equals(tika.detect(prefix));
    }

    private byte[] readBounded(InputStream content) {
        if (content == null) {
            return new byte[0];
        }
        try {
            return content.readNBytes((int) (maxBytes + 1));
        } catch (IOException e) {
            throw new StorageException("Unable to read uploaded content", e);
        }
    }
}
