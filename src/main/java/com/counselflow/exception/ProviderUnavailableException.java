package com.counselflow.exception;

/**
 * All providers and retries were exhausted.
 */
public class ProviderUnavailableException extends AiCoreException {

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
