package com.rollbook.attendance.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a successful mark. The id is the same across resubmissions
 * for one class and day.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MarkAttendanceResponseDTO {

    private Long attendanceId;
}
