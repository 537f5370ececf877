package com.zakat.hawl.api;

import com.zakat.hawl.domain.exception.AuditWriteFailureException;
import com.zakat.hawl.domain.exception.DetectionRunInProgressException;
import com.zakat.hawl.domain.exception.HawlEngineException;
import com.zakat.hawl.domain.exception.PriceUnavailableException;
import com.zakat.hawl.domain.exception.RecordValidationException;
import com.zakat.hawl.domain.model.LifecycleFailure;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps engine failures to HTTP responses with a uniform {@link ErrorResponse} body.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    public static HttpStatus statusOf(LifecycleFailure failure) {
        switch (failure) {
            case RECORD_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case INSUFFICIENT_JUSTIFICATION:
                return HttpStatus.BAD_REQUEST;
            case INVALID_TRANSITION:
            case DUPLICATE_OPEN_WINDOW:
            default:
                return HttpStatus.CONFLICT;
        }
    }

    @ExceptionHandler(RecordValidationException.class)
    public ResponseEntity<ErrorResponse> handleRecordValidation(RecordValidationException ex, HttpServletRequest request) {
        log.warn("Record request rejected: {}", ex.getMessage());
        return respond(statusOf(ex.getFailure()), ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(PriceUnavailableException.class)
    public ResponseEntity<ErrorResponse> handlePriceUnavailable(PriceUnavailableException ex, HttpServletRequest request) {
        log.error("Nisab threshold unavailable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(AuditWriteFailureException.class)
    public ResponseEntity<ErrorResponse> handleAuditWriteFailure(AuditWriteFailureException ex, HttpServletRequest request) {
        log.error("Audit write failed, operation rolled back: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(),
                "The operation could not be recorded and was not applied", request);
    }

    @ExceptionHandler(DetectionRunInProgressException.class)
    public ResponseEntity<ErrorResponse> handleDetectionInProgress(DetectionRunInProgressException ex,
                                                                   HttpServletRequest request) {
        log.warn(ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage(), request);
    }

    /**
     * A concurrent request opened a window between the duplicate check and the insert.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex, HttpServletRequest request) {
        log.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());
        return respond(HttpStatus.CONFLICT, LifecycleFailure.DUPLICATE_OPEN_WINDOW.name(),
                "The request conflicts with the current state of the user's records", request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> ErrorResponse.FieldError.builder()
                        .field(error.getField())
                        .rejectedValue(error.getRejectedValue() != null ? String.valueOf(error.getRejectedValue()) : null)
                        .message(error.getDefaultMessage())
                        .build())
                .collect(Collectors.toList());

        log.warn("Request validation failed: {} field error(s)", fieldErrors.size());

        ErrorResponse error = ErrorResponse.builder()
                .errorCode("VALIDATION_ERROR")
                .message("Request validation failed")
                .status(HttpStatus.BAD_REQUEST.value())
                .path(request.getRequestURI())
                .fieldErrors(fieldErrors)
                .build();
        return ResponseEntity.badRequest().body(error);
    }

    @ExceptionHandler({
            ConstraintViolationException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingRequestHeaderException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), request);
    }

    @ExceptionHandler(HawlEngineException.class)
    public ResponseEntity<ErrorResponse> handleEngine(HawlEngineException ex, HttpServletRequest request) {
        log.error("Engine error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", request);
    }

    static ResponseEntity<ErrorResponse> respond(HttpStatus status, String errorCode, String message,
                                                 HttpServletRequest request) {
        ErrorResponse error = ErrorResponse.builder()
                .errorCode(errorCode)
                .message(message)
                .status(status.value())
                .path(request.getRequestURI())
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
