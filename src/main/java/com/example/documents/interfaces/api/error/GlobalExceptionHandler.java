package com.example.documents.interfaces.api.error;

import com.example.documents.domain.exception.DanglingDocumentException;
import com.example.documents.domain.exception.DocumentNotFoundException;
import com.example.documents.domain.exception.DocumentValidationException;
import com.example.documents.infrastructure.exception.InfrastructureException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Centralized API-layer exception handler that maps domain and infrastructure failures to HTTP responses.
 * Storage failures are logged in full but reported with a generic message, so file system paths never reach clients.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Maps a record whose blob is missing to a 404 response with its own error code.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(DanglingDocumentException.class)
    public ResponseEntity<ErrorResponse> handleDangling(DanglingDocumentException ex, HttpServletRequest request) {
        return buildResponse(request, HttpStatus.NOT_FOUND, "FILE_NOT_FOUND", "File not found on disk");
    }

    /**
     * Maps unknown document ids to a 404 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(DocumentNotFoundException ex, HttpServletRequest request) {
        return buildResponse(request, HttpStatus.NOT_FOUND, "DOCUMENT_NOT_FOUND", "Document not found");
    }

    /**
     * Maps rejected uploads to a 400 response carrying the actionable validation message.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(DocumentValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(DocumentValidationException ex, HttpServletRequest request) {
        return buildResponse(request, HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage());
    }

    /**
     * Maps uploads cut off by the servlet container's multipart limit to the same validation error.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxUploadSize(MaxUploadSizeExceededException ex, HttpServletRequest request) {
        return buildResponse(request, HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "File size exceeds the upload limit.");
    }

    /**
     * Maps a missing {@code document} part or a malformed id to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler({
            MissingServletRequestPartException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        return buildResponse(request, HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        return buildResponse(request, HttpStatus.METHOD_NOT_ALLOWED, "METHOD_NOT_ALLOWED", ex.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
        return buildResponse(request, HttpStatus.NOT_FOUND, "NOT_FOUND", "No endpoint " + request.getRequestURI());
    }

    /**
     * Maps disk and database failures to a 500 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<ErrorResponse> handleInfrastructure(InfrastructureException ex, HttpServletRequest request) {
        log.error("Storage failure on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return buildResponse(request, HttpStatus.INTERNAL_SERVER_ERROR, "STORAGE_ERROR", "Internal server error");
    }

    /**
     * Fallback for unexpected exceptions.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return buildResponse(request, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", "Internal server error");
    }

    private ResponseEntity<ErrorResponse> buildResponse(HttpServletRequest request,
                                                       HttpStatus status,
                                                       String errorCode,
                                                       String message) {
        ErrorResponse response = ErrorResponse.of(status.value(), errorCode, message, request.getRequestURI());
        return ResponseEntity.status(status).body(response);
    }
}
