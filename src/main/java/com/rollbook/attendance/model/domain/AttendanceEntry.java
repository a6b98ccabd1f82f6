package com.rollbook.attendance.model.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One student's outcome inside a day's attendance record.
 *
 * {@code studentId} is a plain column, not a foreign key. Old entries may point at
 * a student that is no longer on the roster.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AttendanceEntry {

    @Column(name = "student_id", nullable = false)
    private Long studentId;

    @Column(name = "present", nullable = false)
    private boolean present;

    @Column(name = "remarks", length = 500)
    private String remarks;
}
