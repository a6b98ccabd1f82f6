package com.rollbook.attendance.exception;

/**
 * Exception thrown when no attendance record exists for a class and day.
 */
public class AttendanceRecordNotFoundException extends RuntimeException {

    public AttendanceRecordNotFoundException(String className, String date) {
        super("No attendance recorded for " + className + " on " + date);
    }
}
