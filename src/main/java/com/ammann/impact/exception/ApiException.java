/* (C)2026 */
package com.ammann.impact.exception;

/**
 * Base unchecked exception for all application-level errors raised by the impact window engine.
 *
 * <p>Subclasses represent the failure categories callers can act on (invalid analysis options,
 * unknown events) and are mapped to HTTP status codes by {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }

    public ApiException(String message) {
        super(message);
    }

    public ApiException(Throwable cause) {
        super(cause);
    }
}
