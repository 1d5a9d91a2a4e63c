package com.counselflow.exception;

import lombok.Getter;

/**
 * Consensus needs at least two usable provider results.
 */
@Getter
public class InsufficientProvidersException extends AiCoreException {

    private final int usableResults;

    public InsufficientProvidersException(int usableResults) {
        super("Consensus requires at least 2 usable provider results, got " + usableResults);
        this.usableResults = usableResults;
    }
}
