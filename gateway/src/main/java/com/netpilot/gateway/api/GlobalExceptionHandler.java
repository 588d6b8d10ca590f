package com.netpilot.gateway.api;

import com.netpilot.gateway.dispatch.DispatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Malformed request bodies become {@code {success:false, error}} with HTTP 400,
 * the same shape callers already handle for failed operations.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<DispatchResult> handleValidation(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getAllErrors().stream()
                .map(e -> (e instanceof FieldError f ? f.getField() + " " : "") + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Rejected request: {}", detail);
        return ResponseEntity.badRequest().body(DispatchResult.failure("bad_request", "Invalid request: " + detail));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<DispatchResult> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(DispatchResult.failure("bad_request", "Malformed request body"));
    }
}
