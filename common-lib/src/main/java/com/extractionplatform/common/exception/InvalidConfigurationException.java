package com.extractionplatform.common.exception;

/**
 * Synthesis tables or phase plan are inconsistent. Raised at startup, before any run.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
