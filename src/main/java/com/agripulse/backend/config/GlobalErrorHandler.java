package com.agripulse.backend.config;

import com.agripulse.backend.cache.SnapshotUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalErrorHandler {

    @ExceptionHandler(SnapshotUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleUnavailable(SnapshotUnavailableException ex) {
        log.warn("⚙️ Snapshot unavailable for {}: {}", ex.topic(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("detail", ex.getMessage()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, String>> handleStatus(ResponseStatusException ex) {
        String reason = ex.getReason() != null ? ex.getReason() : ex.getStatusCode().toString();
        return ResponseEntity.status(ex.getStatusCode()).body(Map.of("detail", reason));
    }

    @ExceptionHandler(Throwable.class)
    public ResponseEntity<Map<String, String>> handleException(Throwable ex) {
        log.error("❌ Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("detail", "Server Error: " + ex.getMessage()));
    }
}
