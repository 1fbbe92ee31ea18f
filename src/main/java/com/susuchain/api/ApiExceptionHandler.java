package com.susuchain.api;

import com.susuchain.domain.exception.ChainReadException;
import com.susuchain.domain.exception.DutyNotFoundException;
import com.susuchain.domain.exception.InvalidInputException;
import com.susuchain.domain.exception.QueryException;
import com.susuchain.domain.exception.RegistrationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({InvalidInputException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleInvalidInput(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), false);
    }

    @ExceptionHandler(DutyNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleDutyNotFound(DutyNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage(), false);
    }

    @ExceptionHandler(RegistrationException.class)
    public ResponseEntity<Map<String, Object>> handleRegistration(RegistrationException e) {
        log.warn("Registration failed for {}: {}", e.getTarget(), e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getMessage(), e.isOutcomeUnknown());
    }

    @ExceptionHandler({QueryException.class, ChainReadException.class})
    public ResponseEntity<Map<String, Object>> handleUpstream(RuntimeException e) {
        log.warn("Upstream query failed: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getMessage(), false);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, boolean outcomeUnknown) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", message);
        if (outcomeUnknown) {
            body.put("outcomeUnknown", true);
        }
        return ResponseEntity.status(status).body(body);
    }
}
