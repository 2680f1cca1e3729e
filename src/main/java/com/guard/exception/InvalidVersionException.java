package com.guard.exception;

/**
 * Thrown when a declared API version is not a semantic version.
 */
public class InvalidVersionException extends ApiGuardException {

    public InvalidVersionException(String message) {
        super(message);
    }
}
