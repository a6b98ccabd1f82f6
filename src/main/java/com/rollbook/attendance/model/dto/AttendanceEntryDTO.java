package com.rollbook.attendance.model.dto;

import com.rollbook.attendance.model.domain.AttendanceEntry;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One student's presence within a submitted attendance sheet.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AttendanceEntryDTO {

    /**
     * Id of the student on the roster.
     */
    @NotNull(message = "studentId is required")
    private Long studentId;

    /**
     * Must be a JSON boolean. Strings and numbers are rejected during parsing.
     */
    @NotNull(message = "present must be true or false")
    private Boolean present;

    @Size(max = 500)
    private String remarks;

    public AttendanceEntry toEntity() {
        return AttendanceEntry.builder()
                .studentId(studentId)
                .present(present)
                .remarks(remarks)
                .build();
    }

    public static AttendanceEntryDTO fromEntity(AttendanceEntry entry) {
        return AttendanceEntryDTO.builder()
                .studentId(entry.getStudentId())
                .present(entry.isPresent())
                .remarks(entry.getRemarks())
                .build();
    }
}
