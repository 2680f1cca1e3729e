package com.guard.exception;

/**
 * Thrown when an API document cannot be turned into the internal spec model: it is not
 * parseable, it has no {@code info.version}, or one of its operations is malformed.
 */
public class InvalidSpecException extends ApiGuardException {

    public InvalidSpecException(String message) {
        super(message);
    }

    public InvalidSpecException(String message, Throwable cause) {
        super(message, cause);
    }
}
