package com.rollbook.attendance.model.dto;

import java.time.LocalDateTime;

import com.rollbook.attendance.model.domain.Teacher;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Public view of a teacher. Carries no password material.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TeacherDTO {

    private Long id;

    private String name;

    private String email;

    private String phone;

    private String subject;

    private LocalDateTime createdAt;

    /**
     * Create from entity.
     */
    public static TeacherDTO fromEntity(Teacher teacher) {
        return TeacherDTO.builder()
                .id(teacher.getId())
                .name(teacher.getName())
                .email(teacher.getEmail())
                .phone(teacher.getPhone())
                .subject(teacher.getSubject())
                .createdAt(teacher.getCreatedAt())
                .build();
    }
}
