package com.altar_funds.controller;

import com.altar_funds.dto.ApiResponse;
import com.altar_funds.exception.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps payment errors to {@link ApiResponse} failures. None of them is fatal to the caller's flow.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(GivingValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(GivingValidationException ex) {
        log.info("Rejected giving input: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ApiResponse<Void>> handleBadInput(ServerWebInputException ex) {
        log.info("Unreadable request: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, ex.getReason());
    }

    @ExceptionHandler(ProviderDeclineException.class)
    public ResponseEntity<ApiResponse<Void>> handleDecline(ProviderDeclineException ex) {
        log.info("Payment declined: {}", ex.getMessage());
        return respond(HttpStatus.PAYMENT_REQUIRED, ex.getMessage());
    }

    @ExceptionHandler(AmbiguousOutcomeException.class)
    public ResponseEntity<ApiResponse<Void>> handleAmbiguous(AmbiguousOutcomeException ex) {
        log.warn("Payment outcome unknown: {}", ex.getMessage());
        return respond(HttpStatus.ACCEPTED, ex.getMessage());
    }

    @ExceptionHandler(PaymentSessionNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleSessionNotFound(PaymentSessionNotFoundException ex) {
        log.info("Unknown payment session: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Void>> handleConflict(IllegalStateException ex) {
        log.warn("Conflicting request: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(NetworkException.class)
    public ResponseEntity<ApiResponse<Void>> handleNetwork(NetworkException ex) {
        log.error("Backend call failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "Could not reach AltarFunds, please try again");
    }

    private static ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiResponse.fail(message));
    }
}
