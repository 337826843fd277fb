package com.gaia.exception;

/**
 * Exception raised by an executor adapter when the remote backend cannot
 * produce a usable response (transport failure, unreadable body).
 */
public class ExecutionException extends GaiaException {

    public ExecutionException(String message) {
        super(message);
    }

    public ExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
