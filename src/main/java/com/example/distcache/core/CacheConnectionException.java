package com.example.distcache.core;

/**
 * The backend could not be reached. Callers should back off and retry.
 */
public class CacheConnectionException extends CacheException {

    public CacheConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
