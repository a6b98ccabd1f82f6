package com.rollbook.attendance.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a successful login.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LoginResponseDTO {

    /**
     * Bearer token to send as {@code Authorization: Bearer <token>}.
     */
    private String token;

    private TeacherDTO teacher;
}
