package com.routecast.performance.controller;

import com.routecast.common.exception.LedgerUnavailableException;
import com.routecast.common.exception.RoutingEngineException;
import com.routecast.performance.dto.ApiErrorDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps engine failures to HTTP: bad input 400, lost publish race 409, storage 503.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorDTO> badRequest(IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(LedgerUnavailableException.class)
    public ResponseEntity<ApiErrorDTO> storageUnavailable(LedgerUnavailableException e) {
        log.error("Storage unavailable", e);
        return body(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(RoutingEngineException.class)
    public ResponseEntity<ApiErrorDTO> conflict(RoutingEngineException e) {
        log.warn("Routing engine conflict: {}", e.getMessage());
        return body(HttpStatus.CONFLICT, e.getMessage());
    }

    private static ResponseEntity<ApiErrorDTO> body(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ApiErrorDTO(status.value(), status.getReasonPhrase(), message));
    }
}
