package com.camsnapshot.camsnapshot.controller;

import com.camsnapshot.camsnapshot.exception.BackendFaultException;
import com.camsnapshot.camsnapshot.exception.InvalidTimestampException;
import com.camsnapshot.camsnapshot.exception.SnapshotNotFoundException;
import com.camsnapshot.camsnapshot.exception.SnapshotUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class SnapshotExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(SnapshotExceptionHandler.class);

    @ExceptionHandler({SnapshotNotFoundException.class, SnapshotUnavailableException.class})
    public ResponseEntity<Map<String, Object>> notFound(RuntimeException e) {
        return body(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(InvalidTimestampException.class)
    public ResponseEntity<Map<String, Object>> invalidTimestamp(InvalidTimestampException e) {
        return body(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(BackendFaultException.class)
    public ResponseEntity<Map<String, Object>> backendFault(BackendFaultException e) {
        log.error("Snapshot backend fault (status {}): {}", e.getStatusCode(), e.getMessage());
        return body(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("status", status.value(), "message", message == null ? status.getReasonPhrase() : message));
    }
}
