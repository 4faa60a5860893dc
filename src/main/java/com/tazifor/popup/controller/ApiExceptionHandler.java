package com.tazifor.popup.controller;

import com.tazifor.popup.exception.CampaignNotFoundException;
import com.tazifor.popup.exception.ConfigException;
import com.tazifor.popup.exception.InvalidVisitorContextException;
import com.tazifor.popup.exception.TransientStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps the engine's exceptions to HTTP answers.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ConfigException.class)
    public ResponseEntity<Map<String, Object>> handleConfig(ConfigException e) {
        return ResponseEntity.badRequest().body(Map.of(
            "error", "Invalid configuration",
            "violations", e.getViolations()
        ));
    }

    @ExceptionHandler({InvalidVisitorContextException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(CampaignNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(CampaignNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(TransientStoreException.class)
    public ResponseEntity<Map<String, Object>> handleStore(TransientStoreException e) {
        log.warn("Store unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", "Store unavailable"));
    }
}
