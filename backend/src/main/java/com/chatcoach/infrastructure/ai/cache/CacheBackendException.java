package com.chatcoach.infrastructure.ai.cache;

public class CacheBackendException extends RuntimeException {

    public CacheBackendException(String message) {
        super(message);
    }

    public CacheBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
