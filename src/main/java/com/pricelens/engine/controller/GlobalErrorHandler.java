package com.pricelens.engine.controller;

import com.pricelens.engine.error.CatalogUpdateException;
import com.pricelens.engine.error.EmptyInputException;
import com.pricelens.engine.error.InvalidTransitionException;
import com.pricelens.engine.error.MissingRequiredFieldException;
import com.pricelens.engine.error.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps engine exceptions to JSON error bodies: input problems 400, unknown ids 404,
 * lifecycle conflicts 409, catalog write failures 502.
 */
@RestControllerAdvice
public class GlobalErrorHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalErrorHandler.class);

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBind(WebExchangeBindException ex) {
        List<Map<String, Object>> errors = ex.getAllErrors().stream().map(err -> {
            Map<String, Object> e = new HashMap<>();
            e.put("object", err.getObjectName());
            e.put("code", err.getCode());
            e.put("message", err.getDefaultMessage());
            return e;
        }).collect(Collectors.toList());
        log.warn("Request binding failed: {}", errors);
        Map<String, Object> body = new HashMap<>();
        body.put("error", "bad_request");
        body.put("details", errors);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException ex) {
        log.warn("Input error: {}", ex.getReason());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "bad_request");
        body.put("reason", ex.getReason());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(EmptyInputException.class)
    public ResponseEntity<Map<String, Object>> handleEmpty(EmptyInputException ex) {
        log.warn("Import rejected: {}", ex.getMessage());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "empty_input");
        body.put("message", ex.getMessage());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(MissingRequiredFieldException.class)
    public ResponseEntity<Map<String, Object>> handleMissing(MissingRequiredFieldException ex) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", "missing_required_fields");
        body.put("missing", ex.getMissing());
        body.put("message", ex.getMessage());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad argument: {}", ex.getMessage());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "bad_request");
        body.put("message", ex.getMessage());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", "not_found");
        body.put("message", ex.getMessage());
        return ResponseEntity.status(404).body(body);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<Map<String, Object>> handleTransition(InvalidTransitionException ex) {
        log.info("Rejected lifecycle action: {}", ex.getMessage());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "invalid_transition");
        body.put("message", ex.getMessage());
        body.put("record_type", ex.getRecordType());
        body.put("record_id", ex.getRecordId());
        body.put("status", ex.getCurrentStatus());
        body.put("action", ex.getAction());
        return ResponseEntity.status(409).body(body);
    }

    @ExceptionHandler(CatalogUpdateException.class)
    public ResponseEntity<Map<String, Object>> handleCatalog(CatalogUpdateException ex) {
        log.warn("Catalog update failed: {}", ex.getMessage());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "catalog_update_failed");
        body.put("message", ex.getMessage());
        return ResponseEntity.status(502).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleOther(Exception ex) {
        log.error("Unhandled error", ex);
        Map<String, Object> body = new HashMap<>();
        body.put("error", "server_error");
        body.put("exception", ex.getClass().getSimpleName());
        body.put("message", ex.getMessage());
        return ResponseEntity.status(500).body(body);
    }
}
