package com.lexassist.planner.service;

/**
 * Raised by the completion client once throttling persists past the last backoff attempt.
 * The classifier and the optimizer treat it like any other upstream failure.
 */
public class ThrottledException extends RuntimeException {

    public ThrottledException(String message) {
        super(message);
    }

    public ThrottledException(String message, Throwable cause) {
        super(message, cause);
    }
}
