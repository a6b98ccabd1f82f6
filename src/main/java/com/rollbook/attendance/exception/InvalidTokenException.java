package com.rollbook.attendance.exception;

/**
 * Exception thrown when an access token cannot be issued or read back.
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
