package com.example.zenflow.exception;

/**
 * The shared progress store could not be reached.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
