package com.flagship.pawn_ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger failures to HTTP responses.
 *
 * Validation, referential and state-conflict errors return their code and message.
 * Consistency errors and anything unexpected return a generic body; the detail is
 * only written to the server log.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerInvariantViolationException.class)
    public ResponseEntity<ErrorResponse> handleInvariantViolation(LedgerInvariantViolationException e) {
        log.error("Ledger invariant violated: {}", e.getMessage(), e);

        ErrorResponse error = ErrorResponse.builder()
            .error("Internal Ledger Error")
            .code(LedgerInvariantViolationException.ERROR_CODE)
            .message("An internal ledger error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedgerException(LedgerException e) {
        log.warn("Ledger request rejected: kind={}, code={}, message={}", e.getKind(), e.getErrorCode(), e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error(e.getKind().name())
            .code(e.getErrorCode())
            .message(e.getMessage())
            .details(e.getDetails().isEmpty() ? null : e.getDetails())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(e.getKind().getHttpStatus()).body(error);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());

        ErrorResponse error = ErrorResponse.builder()
            .error(ErrorKind.VALIDATION.name())
            .code("MISSING_HEADER")
            .message("Required header '" + e.getHeaderName() + "' is missing")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing required parameter: {}", e.getParameterName());

        ErrorResponse error = ErrorResponse.builder()
            .error(ErrorKind.VALIDATION.name())
            .code("MISSING_PARAMETER")
            .message("Required parameter '" + e.getParameterName() + "' is missing")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid value for parameter {}: {}", e.getName(), e.getValue());

        ErrorResponse error = ErrorResponse.builder()
            .error(ErrorKind.VALIDATION.name())
            .code("INVALID_PARAMETER")
            .message("Invalid value for parameter '" + e.getName() + "'")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ErrorResponse error = ErrorResponse.builder()
            .error(ErrorKind.VALIDATION.name())
            .code("INVALID_REQUEST")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrity(DataIntegrityViolationException e) {
        log.warn("Write rejected by database constraint: {}", e.getMostSpecificCause().getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error(ErrorKind.STATE_CONFLICT.name())
            .code("CONSTRAINT_VIOLATION")
            .message("The request conflicts with existing ledger data")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
            .error("Internal Server Error")
            .code("INTERNAL_ERROR")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String code;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
