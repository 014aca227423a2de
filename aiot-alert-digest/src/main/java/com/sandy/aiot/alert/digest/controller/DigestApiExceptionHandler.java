package com.sandy.aiot.alert.digest.controller;

import com.sandy.aiot.alert.digest.exception.DigestStoreUnavailableException;
import com.sandy.aiot.alert.digest.exception.DigestWriteRejectedException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps request and store errors to {success:false, message} bodies.
 */
@Slf4j
@RestControllerAdvice
public class DigestApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResp> handleBadRequest(IllegalArgumentException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorResp.of(ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResp> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorResp.of("Malformed request body"));
    }

    @ExceptionHandler(DigestWriteRejectedException.class)
    public ResponseEntity<ErrorResp> handleRejected(DigestWriteRejectedException ex) {
        log.warn("Digest write rejected: {}", ex.getMessage());
        return ResponseEntity.unprocessableEntity().body(ErrorResp.of("Request could not be stored: " + ex.getMessage()));
    }

    @ExceptionHandler(DigestStoreUnavailableException.class)
    public ResponseEntity<ErrorResp> handleStoreUnavailable(DigestStoreUnavailableException ex) {
        log.warn("Digest store unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorResp.of("Digest store unavailable, please retry"));
    }

    @Data
    public static class ErrorResp {
        private boolean success;
        private String message;
        public static ErrorResp of(String msg) { ErrorResp r = new ErrorResp(); r.success = false; r.message = msg; return r; }
    }
}
