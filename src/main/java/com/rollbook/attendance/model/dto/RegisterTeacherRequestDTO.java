package com.rollbook.attendance.model.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Request DTO for registering a teacher account.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RegisterTeacherRequestDTO {

    @NotBlank(message = "name is required")
    @Size(max = 120)
    private String name;

    @NotBlank(message = "email is required")
    @Email(message = "email must be a valid address")
    @Size(max = 200)
    private String email;

    @NotBlank(message = "password is required")
    @ToString.Exclude
    private String password;

    @Size(max = 40)
    private String phone;

    @Size(max = 120)
    private String subject;
}
