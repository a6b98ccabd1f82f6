package com.rollbook.attendance.exception;

/**
 * Exception thrown when a request is missing fields or carries malformed values.
 */
public class RequestValidationException extends RuntimeException {

    public RequestValidationException(String message) {
        super(message);
    }

    public RequestValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
