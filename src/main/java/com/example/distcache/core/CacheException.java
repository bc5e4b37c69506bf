package com.example.distcache.core;

/**
 * Base type for every error a {@link Cache} raises.
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Whether the same call may succeed if repeated later. */
    public boolean isRetryable() {
        return false;
    }
}
