package com.guard.exception;

/**
 * Thrown when a usage log was supplied but cannot be read or does not have the expected shape.
 * A log that was simply not supplied is never an error.
 */
public class LogParseException extends ApiGuardException {

    public LogParseException(String message) {
        super(message);
    }

    public LogParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
