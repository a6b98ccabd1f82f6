package com.rollbook.attendance.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Attendance of one student over a date range.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudentAttendanceStatsDTO {

    private Long studentId;

    /**
     * Roster roll number, null when the student is no longer on the roster.
     */
    private Integer roll;

    private String name;

    private int present;

    private int total;

    /**
     * present / total as a percentage with one decimal.
     */
    private double percentage;

    private boolean perfect;

    private boolean belowThreshold;

    private boolean chronicAbsence;

    /**
     * False when the entries reference a student id missing from the roster.
     */
    private boolean resolved;
}
