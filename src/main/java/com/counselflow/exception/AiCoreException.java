package com.counselflow.exception;

/**
 * Base class for every failure surfaced by the orchestration core.
 */
public class AiCoreException extends RuntimeException {

    public AiCoreException(String message) {
        super(message);
    }

    public AiCoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
