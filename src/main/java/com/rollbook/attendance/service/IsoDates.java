package com.rollbook.attendance.service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import com.rollbook.attendance.exception.RequestValidationException;

/**
 * Guards the "YYYY-MM-DD" form that attendance dates are stored and range-queried in.
 * Ranges are compared as strings, so a non-padded or otherwise odd date would
 * silently fall in or out of a range.
 */
public final class IsoDates {

    private static final int ISO_DATE_LENGTH = 10;

    private IsoDates() {
    }

    /**
     * Return the trimmed value if it is a real calendar day in zero-padded ISO form.
     *
     * @throws RequestValidationException otherwise
     */
    public static String requireIsoDate(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new RequestValidationException(field + " is required");
        }
        String trimmed = value.trim();
        if (trimmed.length() != ISO_DATE_LENGTH) {
            throw new RequestValidationException(field + " must be YYYY-MM-DD");
        }
        try {
            LocalDate.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            throw new RequestValidationException(field + " must be a calendar date in YYYY-MM-DD form", e);
        }
        return trimmed;
    }
}
