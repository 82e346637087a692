package com.flagship.agreement_ledger.contract.exception;

import com.flagship.agreement_ledger.common.LedgerError;
import com.flagship.agreement_ledger.common.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger errors and request problems to HTTP responses.
 *
 * Ledger errors keep their kind and numeric code in the body, so clients can
 * match on them regardless of the HTTP status.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedgerException(LedgerException e) {
        HttpStatus status = statusOf(e.getError());
        log.info("Ledger operation failed: error={}, status={}, message={}", e.getError(), status.value(), e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error(e.getError().name())
            .code(e.getError().getCode())
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).body(error);
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
            .error("VALIDATION_FAILED")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("MALFORMED_REQUEST")
            .message("Request could not be read")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("INVALID_REQUEST")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
            .error("INTERNAL_ERROR")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusOf(LedgerError error) {
        return switch (error) {
            case TRANSACTION_NOT_FOUND, ESCROW_NOT_FOUND, INVOICE_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case UNAUTHORIZED, INVALID_SIGNATURE -> HttpStatus.FORBIDDEN;
            case REENTRANCY_DETECTED, ESCROW_EXPIRED, INVOICE_EXPIRED,
                 CONDITIONS_NOT_MET, INVOICE_ALREADY_APPROVED -> HttpStatus.CONFLICT;
            case INVALID_ADDRESS, INVALID_AMOUNT -> HttpStatus.BAD_REQUEST;
        };
    }

    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        Integer code;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
