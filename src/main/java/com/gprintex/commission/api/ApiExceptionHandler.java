package com.gprintex.commission.api;

import com.gprintex.commission.client.BillingClient.BillingApiException;
import com.gprintex.commission.domain.Commission;
import com.gprintex.commission.domain.ValidationResult;
import com.gprintex.commission.exception.AssignmentOverlapException;
import com.gprintex.commission.exception.CommissionException;
import com.gprintex.commission.exception.CommissionLockedException;
import com.gprintex.commission.exception.ConfigNotFoundException;
import com.gprintex.commission.exception.DuplicateCommissionException;
import com.gprintex.commission.exception.EntityNotFoundException;
import com.gprintex.commission.exception.InvalidTransitionException;
import com.gprintex.commission.exception.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Maps domain failures to HTTP responses with a stable error code.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({EntityNotFoundException.class, ConfigNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(CommissionException ex, HttpServletRequest request) {
        log.debug("Not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage(), request);
    }

    /**
     * The conflicting commission is returned so callers can pick it up instead of retrying.
     */
    @ExceptionHandler(DuplicateCommissionException.class)
    public ResponseEntity<DuplicateResponse> handleDuplicate(DuplicateCommissionException ex, HttpServletRequest request) {
        log.info("Duplicate commission request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new DuplicateResponse(
            ex.getErrorCode(), ex.getMessage(), request.getRequestURI(), ex.getExisting().orElse(null)));
    }

    @ExceptionHandler({InvalidTransitionException.class, CommissionLockedException.class, AssignmentOverlapException.class})
    public ResponseEntity<ErrorResponse> handleConflict(CommissionException ex, HttpServletRequest request) {
        log.warn("Conflict: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<List<ValidationResult>> handleValidation(ValidationException ex) {
        log.debug("Validation failed: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ex.getErrors());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        log.debug("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        var cause = ex.getMostSpecificCause();
        log.debug("Unreadable request body: {}", cause.getMessage());
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", cause.getMessage(), request);
    }

    @ExceptionHandler({QueryTimeoutException.class, TransientDataAccessException.class})
    public ResponseEntity<ErrorResponse> handleTransient(RuntimeException ex, HttpServletRequest request) {
        log.error("Transient database failure on {}: {}", request.getRequestURI(), ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "DATABASE_UNAVAILABLE",
            "The database did not respond in time, retry the request", request);
    }

    @ExceptionHandler(BillingApiException.class)
    public ResponseEntity<ErrorResponse> handleBilling(BillingApiException ex, HttpServletRequest request) {
        log.error("Billing API failure: status={} message={}", ex.getStatusCode(), ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "BILLING_API_ERROR", ex.getMessage(), request);
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message, HttpServletRequest request) {
        return ResponseEntity.status(status)
            .body(new ErrorResponse(code, message, status.value(), LocalDateTime.now(), request.getRequestURI()));
    }

    public record ErrorResponse(String errorCode, String message, int status, LocalDateTime timestamp, String path) {
    }

    public record DuplicateResponse(String errorCode, String message, String path, Commission existing) {
    }
}
