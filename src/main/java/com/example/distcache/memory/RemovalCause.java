package com.example.distcache.memory;

public enum RemovalCause {
    EXPLICIT,
    EXPIRED,
    EVICTED
}
