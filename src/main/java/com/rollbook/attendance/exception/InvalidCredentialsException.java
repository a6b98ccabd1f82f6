package com.rollbook.attendance.exception;

/**
 * Exception thrown when a login does not match a stored teacher account.
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException() {
        super("Invalid credentials");
    }
}
