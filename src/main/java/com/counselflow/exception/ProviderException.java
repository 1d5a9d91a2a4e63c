package com.counselflow.exception;

import lombok.Getter;

/**
 * A single provider call failed: network error, HTTP error, timeout or an unusable body.
 */
@Getter
public class ProviderException extends AiCoreException {

    private final String provider;
    private final Integer statusCode;

    public ProviderException(String provider, String message) {
        this(provider, message, null, null);
    }

    public ProviderException(String provider, String message, Throwable cause) {
        this(provider, message, null, cause);
    }

    public ProviderException(String provider, String message, Integer statusCode, Throwable cause) {
        super("[" + provider + "] " + message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
    }
}
