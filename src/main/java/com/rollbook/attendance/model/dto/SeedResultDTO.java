package com.rollbook.attendance.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for the demo data seed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeedResultDTO {

    private String message;

    private TeacherDTO teacher;

    private int studentCount;
}
