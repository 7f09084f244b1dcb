/* (C)2026 */
package com.ammann.impact.exception;

/**
 * Exception indicating that analysis options supplied by a caller are malformed or outside
 * the range an analysis accepts.
 *
 * <p>Raised before any data is fetched. Mapped to HTTP 400 (Bad Request) by
 * {@link GlobalExceptionHandler}.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }

    /**
     * Creates validation exception for a parameter that must be present.
     */
    public static ValidationException missingParameter(String paramName) {
        return new ValidationException(
                String.format("Missing required parameter '%s'", paramName));
    }
}
