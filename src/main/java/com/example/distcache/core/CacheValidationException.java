package com.example.distcache.core;

/**
 * Malformed input: null or empty key, null value, negative TTL, bad configuration, or an
 * increment against a value that is not an integer. Never retryable.
 */
public class CacheValidationException extends CacheException {

    public CacheValidationException(String message) {
        super(message);
    }

    public CacheValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
