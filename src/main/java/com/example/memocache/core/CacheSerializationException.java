package com.example.memocache.core;

/**
 * A value could not be encoded for, or decoded from, the remote tier. This is a programming
 * error (unsupported type, corrupt payload) and is never retried.
 */
public class CacheSerializationException extends CacheException {

    public CacheSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
