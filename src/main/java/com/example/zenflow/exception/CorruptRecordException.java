package com.example.zenflow.exception;

/**
 * A stored session or aggregate record could not be decoded.
 */
public class CorruptRecordException extends RuntimeException {

    private final String key;

    public CorruptRecordException(String key, String message) {
        super(message);
        this.key = key;
    }

    public CorruptRecordException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
