package com.rollbook.attendance.model.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for submitting a class's attendance for one day.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MarkAttendanceRequestDTO {

    @NotBlank(message = "date is required")
    @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}", message = "date must be YYYY-MM-DD")
    private String date;

    @NotBlank(message = "className is required")
    @Size(max = 64)
    private String className;

    @NotEmpty(message = "entries must not be empty")
    private List<@Valid @NotNull AttendanceEntryDTO> entries;
}
