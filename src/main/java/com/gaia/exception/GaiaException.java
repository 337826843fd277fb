package com.gaia.exception;

/**
 * Base exception for the GAIA scheduler.
 */
public class GaiaException extends RuntimeException {

    public GaiaException(String message) {
        super(message);
    }

    public GaiaException(String message, Throwable cause) {
        super(message, cause);
    }
}
