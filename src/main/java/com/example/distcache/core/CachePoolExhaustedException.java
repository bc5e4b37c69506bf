package com.example.distcache.core;

/**
 * No pooled connection became available within the configured wait.
 */
public class CachePoolExhaustedException extends CacheConnectionException {

    public CachePoolExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
