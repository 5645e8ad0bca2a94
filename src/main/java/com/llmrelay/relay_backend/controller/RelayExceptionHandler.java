package com.llmrelay.relay_backend.controller;

import com.llmrelay.relay_backend.error.ProviderException;
import com.llmrelay.relay_backend.model.dto.FailureResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Keeps raw exceptions off the wire: every failure leaves as a JSON error body. */
@Slf4j
@RestControllerAdvice
public class RelayExceptionHandler {

    static final String VALIDATION = "VALIDATION";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError err : ex.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(err.getField(), err.getDefaultMessage());
        }
        String message = fields.isEmpty()
                ? "Validation failed"
                : fields.entrySet().iterator().next().getKey() + ": " + fields.entrySet().iterator().next().getValue();
        return badRequest(message, fields);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return badRequest("Malformed request body", Map.of());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return badRequest(ex.getMessage(), Map.of());
    }

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<FailureResponse> handleProvider(ProviderException ex) {
        log.warn("Request failed with {}: {}", ex.getKind(), ex.getMessage());
        return ResponseEntity.status(ex.getKind().getHttpStatus())
                .body(FailureResponse.of(ex.getKind(), ex.getMessage(), ex.getUpstreamStatus(), Instant.now().toString()));
    }

    private static ResponseEntity<Map<String, Object>> badRequest(String message, Map<String, String> fields) {
        Map<String, Object> err = new LinkedHashMap<>();
        err.put("type", VALIDATION);
        err.put("message", message);
        err.put("retryable", false);
        if (!fields.isEmpty()) err.put("fields", fields);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", FailureResponse.ERROR);
        body.put("error", err);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }
}
