package com.community.tracker.controller;

import com.community.tracker.dto.CommonResponse;
import com.community.tracker.exception.ErrorKind;
import com.community.tracker.exception.TrackerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(TrackerException.class)
    public ResponseEntity<CommonResponse<Void>> handleTrackerException(TrackerException ex) {
        ErrorKind kind = ex.getKind();
        HttpStatus status = kind.getStatus();
        String message = kind == ErrorKind.UNKNOWN_COMMUNITY ? "not configured" : ex.getMessage();
        if (kind == ErrorKind.UPSTREAM_UNAVAILABLE) {
            log.warn("Upstream failure: {}", ex.getMessage(), ex);
        } else {
            log.debug("{}: {}", kind, ex.getMessage());
        }
        return ResponseEntity.status(status).body(CommonResponse.error(status.value(), kind.name(), message));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<CommonResponse<Void>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return badRequest(message);
    }

    @ExceptionHandler({ServletRequestBindingException.class, MethodArgumentTypeMismatchException.class,
            IllegalArgumentException.class})
    public ResponseEntity<CommonResponse<Void>> handleBadRequest(Exception ex) {
        return badRequest(ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<CommonResponse<Void>> handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(CommonResponse.error(500, "INTERNAL_ERROR", "Internal server error"));
    }

    private ResponseEntity<CommonResponse<Void>> badRequest(String message) {
        return ResponseEntity.badRequest()
                .body(CommonResponse.error(400, ErrorKind.INVALID_ARGUMENT.name(), message));
    }
}
