package com.pixperfect.assets.exception;

import com.pixperfect.assets.common.exception.AssetException;
import com.pixperfect.assets.common.exception.AssetNotFoundException;
import com.pixperfect.assets.common.exception.InvalidParameterException;
import com.pixperfect.assets.common.exception.StorageUnavailableException;
import com.pixperfect.assets.common.exception.UnprocessableAssetException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps failures to {@code {timestamp, status, error, message}}. {@code error} is a
 * machine-stable reason; server-side detail is logged and never returned.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidParameterException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidParameter(InvalidParameterException ex) {
        log.info("Rejected request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getReason(), ex.getMessage());
    }

    /**
     * Same body for a missing asset and for an asset owned by someone else.
     */
    @ExceptionHandler(AssetNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(AssetNotFoundException ex) {
        log.info(ex.getMessage());
        return error(HttpStatus.NOT_FOUND, ex.getReason(), "Image not found or not authorized");
    }

    @ExceptionHandler(UnprocessableAssetException.class)
    public ResponseEntity<Map<String, Object>> handleUnprocessable(UnprocessableAssetException ex) {
        log.error("Image could not be processed: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getReason(), "Failed to process image");
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleStorageUnavailable(StorageUnavailableException ex) {
        log.error("Storage failure: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getReason(), "Storage is unavailable, try again later");
    }

    @ExceptionHandler(AssetException.class)
    public ResponseEntity<Map<String, Object>> handleAssetException(AssetException ex) {
        log.error("Request failed: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getReason(), "Request failed");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        log.info("Validation failed: {} field error(s)", ex.getBindingResult().getErrorCount());
        return error(HttpStatus.BAD_REQUEST, InvalidParameterException.REASON, message);
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        log.info("Malformed request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, InvalidParameterException.REASON, "Malformed request");
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        log.info("Upload rejected: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, InvalidParameterException.REASON, "File is too large");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unhandled exception: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "An unexpected error occurred");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String reason, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", reason);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
