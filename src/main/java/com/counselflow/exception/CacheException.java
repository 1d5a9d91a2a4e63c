package com.counselflow.exception;

/**
 * Serialization or store failure in the content cache. Callers treat it as a miss.
 */
public class CacheException extends AiCoreException {

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
