package com.counselflow.exception;

/**
 * Bad input. Never retried.
 */
public class ValidationException extends AiCoreException {

    public ValidationException(String message) {
        super(message);
    }
}
