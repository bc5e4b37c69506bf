package com.example.distcache.api;

import com.example.distcache.core.CacheConnectionException;
import com.example.distcache.core.CacheException;
import com.example.distcache.core.CacheValidationException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CacheExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(CacheExceptionHandler.class);
    static final String RETRY_AFTER_SECONDS = "1";

    @ExceptionHandler(CacheValidationException.class)
    public ResponseEntity<Map<String, Object>> invalid(CacheValidationException e) {
        return body(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(CacheConnectionException.class)
    public ResponseEntity<Map<String, Object>> unavailable(CacheConnectionException e) {
        log.warn("Cache backend unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
            .body(Map.of("error", String.valueOf(e.getMessage()), "retryable", true));
    }

    @ExceptionHandler(CacheException.class)
    public ResponseEntity<Map<String, Object>> failed(CacheException e) {
        log.error("Cache operation failed", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, CacheException e) {
        return ResponseEntity.status(status)
            .body(Map.of("error", String.valueOf(e.getMessage()), "retryable", e.isRetryable()));
    }
}
