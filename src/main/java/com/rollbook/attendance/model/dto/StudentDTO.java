package com.rollbook.attendance.model.dto;

import com.rollbook.attendance.model.domain.Student;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Roster entry as returned by the API.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudentDTO {

    private Long id;

    private Integer roll;

    private String name;

    private String className;

    private String parentPhone;

    public static StudentDTO fromEntity(Student student) {
        return StudentDTO.builder()
                .id(student.getId())
                .roll(student.getRoll())
                .name(student.getName())
                .className(student.getClassName())
                .parentPhone(student.getParentPhone())
                .build();
    }
}
