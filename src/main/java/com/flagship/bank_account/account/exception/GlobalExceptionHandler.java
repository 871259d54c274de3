package com.flagship.bank_account.account.exception;

import com.flagship.bank_account.account.AccountError;
import com.flagship.bank_account.account.AccountOperationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for the REST API.
 *
 * The only place where account errors become user-facing messages.
 * Storage failures are rendered with a generic message, never driver text.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(AccountOperationException.class)
    public ResponseEntity<ErrorResponse> handleAccountOperation(AccountOperationException e) {
        AccountError kind = e.getError();
        HttpStatus status = statusFor(kind);

        if (kind.isRequestError()) {
            log.warn("Account request rejected: error={}, message={}", kind, e.getMessage());
        }

        ErrorResponse error = ErrorResponse.builder()
            .error(kind.name())
            .message(kind.isRequestError() ? e.getMessage() : "The service is temporarily unavailable")
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
            .error("Validation Failed")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableMessage(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Malformed Request")
            .message("Request body is malformed or the amount is not a number")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        // Spring MVC errors (unknown path, wrong method, wrong media type) keep their own status
        if (e instanceof org.springframework.web.ErrorResponse frameworkError) {
            return handleFrameworkError(frameworkError);
        }

        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ErrorResponse> handleFrameworkError(org.springframework.web.ErrorResponse frameworkError) {
        HttpStatusCode status = frameworkError.getStatusCode();
        log.warn("Request rejected by the web layer: status={}, detail={}",
            status.value(), frameworkError.getBody().getDetail());

        HttpStatus resolved = HttpStatus.resolve(status.value());
        ErrorResponse error = ErrorResponse.builder()
            .error(resolved != null ? resolved.getReasonPhrase() : String.valueOf(status.value()))
            .message(frameworkError.getBody().getDetail())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).headers(frameworkError.getHeaders()).body(error);
    }

    static HttpStatus statusFor(AccountError kind) {
        return switch (kind) {
            case ACCOUNT_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_AMOUNT, INVALID_ACCOUNT_ID -> HttpStatus.BAD_REQUEST;
            case INSUFFICIENT_FUNDS, ACCOUNT_ALREADY_EXISTS -> HttpStatus.CONFLICT;
            case STORAGE_FAILURE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
