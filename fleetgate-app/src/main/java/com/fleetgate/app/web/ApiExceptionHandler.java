package com.fleetgate.app.web;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fleetgate.common.error.AccessDeniedException;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.store.StoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps FleetGate exceptions to JSON error responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ObjectNode> accessDenied(AccessDeniedException e) {
        log.warn("Rejected admin request: {}", e.getMessage());
        return error(HttpStatus.FORBIDDEN, "Forbidden");
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ObjectNode> store(StoreException e) {
        log.error("Store failure while handling request", e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Store unavailable");
    }

    private static ResponseEntity<ObjectNode> error(HttpStatus status, String message) {
        ObjectNode body = JsonMapper.object();
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }
}
