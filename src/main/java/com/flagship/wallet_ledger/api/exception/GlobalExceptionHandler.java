package com.flagship.wallet_ledger.api.exception;

import com.flagship.wallet_ledger.common.exception.WalletLedgerException;
import com.flagship.wallet_ledger.currency.UnsupportedCurrencyException;
import com.flagship.wallet_ledger.transaction.AmountOutOfRangeException;
import com.flagship.wallet_ledger.transaction.ConcurrencyExhaustedException;
import com.flagship.wallet_ledger.transaction.InsufficientFundsException;
import com.flagship.wallet_ledger.wallet.WalletNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
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
 * Maps domain errors to HTTP responses with a consistent body.
 *
 * Domain errors keep their error code and structured details; unexpected
 * errors are logged in full and reported without internals.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(WalletNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleWalletNotFound(WalletNotFoundException e) {
        log.warn("Wallet not found: {}", e.getWalletId());
        return domainError(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientFunds(InsufficientFundsException e) {
        return domainError(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(AmountOutOfRangeException.class)
    public ResponseEntity<ErrorResponse> handleAmountOutOfRange(AmountOutOfRangeException e) {
        log.warn("Amount out of range: {}", e.getMessage());
        return domainError(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(UnsupportedCurrencyException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedCurrency(UnsupportedCurrencyException e) {
        log.warn("Unsupported currency: {}", e.getCurrency());
        return domainError(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(ConcurrencyExhaustedException.class)
    public ResponseEntity<ErrorResponse> handleConcurrencyExhausted(ConcurrencyExhaustedException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .header(HttpHeaders.RETRY_AFTER, "1")
            .body(toBody(e));
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
        return simpleError(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request could not be parsed");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return simpleError(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return simpleError(HttpStatus.CONFLICT, "INVALID_STATE", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return simpleError(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");
    }

    private ResponseEntity<ErrorResponse> domainError(HttpStatus status, WalletLedgerException e) {
        return ResponseEntity.status(status).body(toBody(e));
    }

    private ErrorResponse toBody(WalletLedgerException e) {
        return ErrorResponse.builder()
            .error(e.getErrorCode())
            .message(e.getMessage())
            .details(e.getDetails())
            .timestamp(Instant.now())
            .build();
    }

    private ResponseEntity<ErrorResponse> simpleError(HttpStatus status, String code, String message) {
        ErrorResponse error = ErrorResponse.builder()
            .error(code)
            .message(message)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(error);
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
