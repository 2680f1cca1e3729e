package com.guard.exception;

/**
 * Base runtime exception for every failure that aborts a compatibility check.
 * <p>
 * Subclasses narrow the cause down to the input that was rejected: a spec document,
 * its declared version, or the usage log. Anything thrown as a plain
 * {@code ApiGuardException} is an I/O problem reading one of the inputs.
 */
public class ApiGuardException extends RuntimeException {

    /**
     * Constructs a new ApiGuardException with the specified detail message.
     *
     * @param message The detail message.
     */
    public ApiGuardException(String message) {
        super(message);
    }

    /**
     * Constructs a new ApiGuardException with the specified detail message and cause.
     *
     * @param message The detail message.
     * @param cause   The underlying cause, may be {@code null}.
     */
    public ApiGuardException(String message, Throwable cause) {
        super(message, cause);
    }
}
