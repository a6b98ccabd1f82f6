package com.rollbook.attendance.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Class-wide attendance statistics over a date range.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AttendanceSummaryDTO {

    /**
     * Present entries over all entries, as a percentage with one decimal.
     * 0 when there are no entries.
     */
    private double average;

    /**
     * Students present on every day they have an entry.
     */
    private int perfectCount;

    /**
     * Students under the below-threshold percentage (75 by default).
     */
    private int below75Count;

    /**
     * Students under the chronic-absence percentage (50 by default).
     * These are also counted in {@link #below75Count}.
     */
    private int chronicAbsenceCount;

    /**
     * Days in range that have a submitted record.
     */
    private int days;

    /**
     * Students with at least one entry in range.
     */
    private int totalStudentsTracked;

    public static AttendanceSummaryDTO empty() {
        return AttendanceSummaryDTO.builder().build();
    }
}
