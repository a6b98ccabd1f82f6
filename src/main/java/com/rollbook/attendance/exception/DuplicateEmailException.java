package com.rollbook.attendance.exception;

/**
 * Exception thrown when registering a teacher whose email is already taken.
 */
public class DuplicateEmailException extends RuntimeException {

    public DuplicateEmailException(String email) {
        super("A teacher with email " + email + " already exists");
    }

    public DuplicateEmailException(String email, Throwable cause) {
        super("A teacher with email " + email + " already exists", cause);
    }
}
