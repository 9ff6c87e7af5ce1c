package com.skilltrace.api;

import com.skilltrace.gap.TargetProfileNotConfiguredException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionAdvice {

    @ExceptionHandler(TargetProfileNotConfiguredException.class)
    public ResponseEntity<Map<String, Object>> handleMissingProfile(TargetProfileNotConfiguredException ex,
                                                                    HttpServletRequest request) {
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "target_profile_not_configured", ex, request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadInput(IllegalArgumentException ex, HttpServletRequest request) {
        return body(HttpStatus.BAD_REQUEST, "invalid_request", ex, request);
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, Exception ex, HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", code);
        body.put("message", ex.getMessage());
        body.put("path", request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
