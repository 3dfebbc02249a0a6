package org.holdem.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Maps poker errors to HTTP statuses for the REST side.
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    @ExceptionHandler(ActionRejectedException.class)
    public ResponseEntity<Map<String, Object>> rejected(ActionRejectedException e) {
        return body(HttpStatus.BAD_REQUEST, e.getMessage(), e.getReason().name());
    }

    @ExceptionHandler(TableFullException.class)
    public ResponseEntity<Map<String, Object>> full(TableFullException e) {
        return body(HttpStatus.CONFLICT, e.getMessage(), "TABLE_FULL");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        String msg = e.getMessage() == null ? "Bad request" : e.getMessage();
        HttpStatus status = msg.startsWith("Unknown table") ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return body(status, msg, null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> conflict(IllegalStateException e) {
        return body(HttpStatus.CONFLICT, e.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalid(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .findFirst().orElse("Invalid request");
        return body(HttpStatus.BAD_REQUEST, msg, null);
    }

    /** Futures joined on the request thread wrap the real cause. */
    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<Map<String, Object>> unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof ActionRejectedException r) return rejected(r);
        if (cause instanceof TableFullException f) return full(f);
        if (cause instanceof IllegalArgumentException a) return badRequest(a);
        if (cause instanceof IllegalStateException s) return conflict(s);
        log.error("Unexpected failure", cause);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error", null);
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String reason) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", error);
        if (reason != null) out.put("reason", reason);
        return ResponseEntity.status(status).body(out);
    }
}
