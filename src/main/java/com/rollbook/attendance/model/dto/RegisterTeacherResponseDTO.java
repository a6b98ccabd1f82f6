package com.rollbook.attendance.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a successful registration.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterTeacherResponseDTO {

    private TeacherDTO teacher;
}
