package com.example.zenflow.exception;

/**
 * A session was reported with a duration that is not a positive number of minutes.
 */
public class InvalidDurationException extends RuntimeException {

    private final int durationMinutes;

    public InvalidDurationException(int durationMinutes) {
        super("Session duration must be positive, got " + durationMinutes + " minutes");
        this.durationMinutes = durationMinutes;
    }

    public int getDurationMinutes() {
        return durationMinutes;
    }
}
