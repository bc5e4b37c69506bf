package com.example.distcache.core;

public class CacheSerializationException extends CacheException {

    public CacheSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
